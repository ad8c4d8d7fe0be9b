package com.foo.pareto.model;

import java.util.List;

/**
 * Output of the Pareto analysis. {@code facts} only reference items present in {@code items}
 * and branches present in {@code branches}.
 */
public record StarSchema(
    List<ItemDimension> items,
    List<BranchDimension> branches,
    List<FactSale> facts,
    ConsistencyCheck consistencyCheck) {

  public StarSchema {
    items = List.copyOf(items);
    branches = List.copyOf(branches);
    facts = List.copyOf(facts);
  }
}
