package com.foo.pareto.model;

import java.math.BigDecimal;
import lombok.Builder;

/** Item-level totals and Pareto position. Grain of {@code dim_articulos}. */
@Builder
public record ItemDimension(
    String articulo,
    String descripcion,
    int ranking,
    AbcClass clasificacionAbc,
    BigDecimal ventaNetaTotal,
    BigDecimal ventaBrutaTotal,
    BigDecimal ventaDevolucionTotal,
    BigDecimal tasaDevolucion,
    BigDecimal porcentajeArticuloGlobal,
    BigDecimal porcentajeAcumulado) {}
