package com.foo.pareto.util;

import org.apache.commons.lang3.StringUtils;

public final class SpreadsheetCellUtil {

  private static final String[] FORMULA_TRIGGERS = {"=", "+", "-", "@", "\t", "\r", "\n"};

  private SpreadsheetCellUtil() {}

  /**
   * Quotes free text that a spreadsheet would otherwise evaluate as a formula. Only for
   * descriptive columns: key columns are exported verbatim so they still join.
   */
  public static String sanitizeText(String value) {
    return StringUtils.startsWithAny(value, FORMULA_TRIGGERS) ? "'" + value : value;
  }
}
