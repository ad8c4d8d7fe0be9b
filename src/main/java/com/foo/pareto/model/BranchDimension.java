package com.foo.pareto.model;

/** Grain of {@code dim_sucursales}. */
public record BranchDimension(String sucursal, BranchType tipo) {

  public static BranchDimension of(String sucursal) {
    return new BranchDimension(sucursal, BranchType.of(sucursal));
  }
}
