package com.foo.pareto.service.pipeline.export;

import java.util.List;

/** Table and column names of the exported star schema, shared by every export format. */
final class StarSchemaColumns {

  static final String DIM_ARTICULOS = "dim_articulos";
  static final String DIM_SUCURSALES = "dim_sucursales";
  static final String FACT_VENTAS = "fact_ventas";

  static final List<String> DIM_ARTICULOS_COLUMNS =
      List.of(
          "Articulo",
          "Descripcion",
          "Ranking",
          "Clasificacion_ABC",
          "Venta_Neta_Total",
          "Venta_Bruta_Total",
          "Venta_Devolucion_Total",
          "Tasa_Devolucion",
          "Porcentaje_Articulo_Global",
          "Porcentaje_Acumulado");

  static final List<String> DIM_SUCURSALES_COLUMNS = List.of("Sucursal", "Tipo");

  static final List<String> FACT_VENTAS_COLUMNS =
      List.of("Articulo", "Sucursal", "Venta_Neta", "Venta_Bruta", "Venta_Devolucion", "Cantidad");

  private StarSchemaColumns() {}
}
