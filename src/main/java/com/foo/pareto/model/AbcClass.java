package com.foo.pareto.model;

import java.math.BigDecimal;

public enum AbcClass {
  A,
  B,
  C;

  /**
   * Classifies a cumulative revenue share. Bounds are inclusive: a share equal to
   * {@code classAThreshold} is still class A.
   */
  public static AbcClass of(
      BigDecimal cumulativeShare, BigDecimal classAThreshold, BigDecimal classBThreshold) {
    if (cumulativeShare.compareTo(classAThreshold) <= 0) {
      return A;
    }
    if (cumulativeShare.compareTo(classBThreshold) <= 0) {
      return B;
    }
    return C;
  }
}
