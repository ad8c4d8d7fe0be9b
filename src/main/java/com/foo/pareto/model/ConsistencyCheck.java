package com.foo.pareto.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Comparison of the item dimension total against the fact rows it was derived from. A result
 * outside tolerance is a warning, never a failure.
 */
public record ConsistencyCheck(
    BigDecimal dimensionTotal, BigDecimal factTotal, BigDecimal difference, BigDecimal tolerance) {

  public static ConsistencyCheck compare(
      BigDecimal dimensionTotal, BigDecimal factTotal, BigDecimal tolerance) {
    BigDecimal difference = dimensionTotal.subtract(factTotal).abs();
    return new ConsistencyCheck(dimensionTotal, factTotal, difference, tolerance);
  }

  /** Strictly below tolerance; identical totals always pass, even with a zero tolerance. */
  @JsonProperty("withinTolerance")
  public boolean withinTolerance() {
    return difference.signum() == 0 || difference.compareTo(tolerance) < 0;
  }
}
