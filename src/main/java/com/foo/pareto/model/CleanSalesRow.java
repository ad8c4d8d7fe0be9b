package com.foo.pareto.model;

import java.math.BigDecimal;
import lombok.Builder;

/** One typed sales line after cleaning, ready for aggregation. */
@Builder
public record CleanSalesRow(
    String articulo,
    String descripcion,
    String sucursal,
    BigDecimal cantidad,
    BigDecimal precio,
    BigDecimal ventaNeta) {}
