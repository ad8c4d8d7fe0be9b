package com.foo.pareto.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

public final class DecimalUtil {

  public static final int MONEY_SCALE = 2;
  public static final int QUANTITY_SCALE = 0;
  public static final int SHARE_SCALE = 4;

  public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

  private DecimalUtil() {}

  /** Values with more integer digits or decimals than this are treated as garbage. */
  static final int MAX_DIGITS = 30;

  /**
   * Lenient numeric coercion for dirty source cells. Surrounding blanks and a leading currency
   * sign are ignored; anything that still does not parse becomes zero.
   */
  public static BigDecimal parseOrZero(String value) {
    return tryParse(value).orElse(BigDecimal.ZERO);
  }

  /**
   * Same cleanup as {@link #parseOrZero}, but empty for blank or unparsable input. Exponents
   * that push the value past {@link #MAX_DIGITS} integer digits or decimals count as
   * unparsable.
   */
  public static Optional<BigDecimal> tryParse(String value) {
    if (StringUtils.isBlank(value)) {
      return Optional.empty();
    }
    String cleaned = StringUtils.deleteWhitespace(value);
    boolean negative = cleaned.startsWith("-");
    cleaned = StringUtils.removeStart(cleaned, "-");
    cleaned = StringUtils.removeStart(cleaned, "$");
    if (negative) {
      cleaned = "-" + cleaned;
    }
    BigDecimal parsed;
    try {
      parsed = new BigDecimal(cleaned);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (parsed.scale() > MAX_DIGITS || parsed.precision() - parsed.scale() > MAX_DIGITS) {
      return Optional.empty();
    }
    return Optional.of(parsed);
  }

  public static BigDecimal money(BigDecimal value) {
    return value.setScale(MONEY_SCALE, ROUNDING);
  }

  public static BigDecimal quantity(BigDecimal value) {
    return value.setScale(QUANTITY_SCALE, ROUNDING);
  }

  public static BigDecimal share(BigDecimal value) {
    return value.setScale(SHARE_SCALE, ROUNDING);
  }

  /** Divides at share precision; a zero denominator yields zero. */
  public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
    if (denominator.signum() == 0) {
      return share(BigDecimal.ZERO);
    }
    return numerator.divide(denominator, SHARE_SCALE, ROUNDING);
  }

  /** Plain (non-scientific) rendering with the given decimal separator. */
  public static String format(BigDecimal value, char decimalSeparator) {
    if (value == null) {
      return "";
    }
    String plain = value.toPlainString();
    return decimalSeparator == '.' ? plain : plain.replace('.', decimalSeparator);
  }
}
