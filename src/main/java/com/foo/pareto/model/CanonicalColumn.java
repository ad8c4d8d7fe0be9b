package com.foo.pareto.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Column labels every normalized sales table is mapped onto. */
@Getter
@RequiredArgsConstructor
public enum CanonicalColumn {

  /** Item code. The only column a source file must provide. */
  ARTICULO("Articulo"),

  DESCRIPCION("Descripcion"),

  CANTIDAD("Cantidad"),

  /** Unit price. */
  PRECIO("Precio"),

  /** Line total, later read as the signed net sale. */
  TOTAL_PRECIO("Total_precio"),

  /** Branch, derived from the source file name rather than from a header. */
  SUCURSAL("Sucursal");

  private final String label;
}
