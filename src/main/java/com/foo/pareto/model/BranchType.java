package com.foo.pareto.model;

public enum BranchType {
  ONLINE,
  FISICA;

  public static BranchType of(String sucursal) {
    return sucursal != null && sucursal.contains("ONLINE") ? ONLINE : FISICA;
  }
}
