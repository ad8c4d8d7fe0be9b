package com.foo.pareto.exception;

import lombok.Getter;

/** Every item nets zero or less, so there is nothing to rank. */
@Getter
public class NoPositiveSalesException extends RuntimeException {

  private final int itemCount;

  public NoPositiveSalesException(int itemCount) {
    super("No item has positive net sales (%d item(s) aggregated)".formatted(itemCount));
    this.itemCount = itemCount;
  }
}
