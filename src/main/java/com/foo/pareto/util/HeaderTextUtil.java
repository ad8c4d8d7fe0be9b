package com.foo.pareto.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class HeaderTextUtil {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

  private HeaderTextUtil() {}

  /**
   * Removes diacritics by decomposing to NFKD and dropping every combining mark. "Código"
   * becomes "Codigo", "ñ" becomes "n". Null becomes the empty string.
   */
  public static String stripAccents(String text) {
    if (text == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
    return COMBINING_MARKS.matcher(decomposed).replaceAll("");
  }

  /** Trimmed, accent-free label as written back to the table. */
  public static String cleanLabel(String label) {
    return stripAccents(label == null ? "" : label.trim());
  }

  /** Lowercase accent-free form used for substring matching. */
  public static String matchKey(String label) {
    return cleanLabel(label).toLowerCase(Locale.ROOT);
  }
}
