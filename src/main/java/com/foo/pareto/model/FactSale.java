package com.foo.pareto.model;

import java.math.BigDecimal;

/** Sales of one item in one branch. Grain of {@code fact_ventas}. */
public record FactSale(
    String articulo,
    String sucursal,
    BigDecimal ventaNeta,
    BigDecimal ventaBruta,
    BigDecimal ventaDevolucion,
    BigDecimal cantidad) {}
