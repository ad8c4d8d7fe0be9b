package com.foo.pareto.support;

import com.foo.pareto.model.AbcClass;
import com.foo.pareto.model.BranchDimension;
import com.foo.pareto.model.ConsistencyCheck;
import com.foo.pareto.model.FactSale;
import com.foo.pareto.model.ItemDimension;
import com.foo.pareto.model.StarSchema;
import java.math.BigDecimal;
import java.util.List;

public final class StarSchemaFixtures {

  private StarSchemaFixtures() {}

  /** One item sold in one physical and one online branch. */
  public static StarSchema singleItem(String articulo, String descripcion) {
    ItemDimension item =
        ItemDimension.builder()
            .articulo(articulo)
            .descripcion(descripcion)
            .ranking(1)
            .clasificacionAbc(AbcClass.A)
            .ventaNetaTotal(new BigDecimal("1000.00"))
            .ventaBrutaTotal(new BigDecimal("1050.00"))
            .ventaDevolucionTotal(new BigDecimal("50.00"))
            .tasaDevolucion(new BigDecimal("0.0476"))
            .porcentajeArticuloGlobal(new BigDecimal("1.0000"))
            .porcentajeAcumulado(new BigDecimal("1.0000"))
            .build();
    List<FactSale> facts =
        List.of(
            new FactSale(
                articulo,
                "CENTRO",
                new BigDecimal("800.00"),
                new BigDecimal("850.00"),
                new BigDecimal("50.00"),
                new BigDecimal("8")),
            new FactSale(
                articulo,
                "TIENDA_ONLINE",
                new BigDecimal("200.00"),
                new BigDecimal("200.00"),
                new BigDecimal("0.00"),
                new BigDecimal("2")));
    return new StarSchema(
        List.of(item),
        List.of(BranchDimension.of("CENTRO"), BranchDimension.of("TIENDA_ONLINE")),
        facts,
        ConsistencyCheck.compare(
            new BigDecimal("1000.00"), new BigDecimal("1000.00"), BigDecimal.ONE));
  }
}
