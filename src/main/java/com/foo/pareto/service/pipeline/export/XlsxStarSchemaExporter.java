package com.foo.pareto.service.pipeline.export;

import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_ARTICULOS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_ARTICULOS_COLUMNS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_SUCURSALES;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_SUCURSALES_COLUMNS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.FACT_VENTAS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.FACT_VENTAS_COLUMNS;

import com.foo.pareto.config.ParetoEtlProperties.ExportFormat;
import com.foo.pareto.model.BranchDimension;
import com.foo.pareto.model.FactSale;
import com.foo.pareto.model.ItemDimension;
import com.foo.pareto.model.StarSchema;
import com.foo.pareto.util.SpreadsheetCellUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.springframework.stereotype.Service;

/** Writes the three tables as sheets of a single workbook. */
@Slf4j
@Service
public class XlsxStarSchemaExporter implements StarSchemaExporter {

  public static final String WORKBOOK_FILE_NAME = "modelo_estrella.xlsx";

  private static final int ROW_ACCESS_WINDOW = 100;

  @Override
  public ExportFormat getFormat() {
    return ExportFormat.XLSX;
  }

  @Override
  public List<Path> export(StarSchema schema, Path outputDirectory) throws IOException {
    Files.createDirectories(outputDirectory);
    Path target = outputDirectory.resolve(WORKBOOK_FILE_NAME);

    try (SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_ACCESS_WINDOW)) {
      CellStyle headerStyle = workbook.createCellStyle();
      Font boldFont = workbook.createFont();
      boldFont.setBold(true);
      headerStyle.setFont(boldFont);

      Sheet items = createSheet(workbook, DIM_ARTICULOS, DIM_ARTICULOS_COLUMNS, headerStyle);
      int rowIdx = 1;
      for (ItemDimension item : schema.items()) {
        Row row = items.createRow(rowIdx++);
        text(row, 0, item.articulo());
        text(row, 1, SpreadsheetCellUtil.sanitizeText(item.descripcion()));
        row.createCell(2).setCellValue(item.ranking());
        text(row, 3, item.clasificacionAbc().name());
        number(row, 4, item.ventaNetaTotal());
        number(row, 5, item.ventaBrutaTotal());
        number(row, 6, item.ventaDevolucionTotal());
        number(row, 7, item.tasaDevolucion());
        number(row, 8, item.porcentajeArticuloGlobal());
        number(row, 9, item.porcentajeAcumulado());
      }

      Sheet branches = createSheet(workbook, DIM_SUCURSALES, DIM_SUCURSALES_COLUMNS, headerStyle);
      rowIdx = 1;
      for (BranchDimension branch : schema.branches()) {
        Row row = branches.createRow(rowIdx++);
        text(row, 0, branch.sucursal());
        text(row, 1, branch.tipo().name());
      }

      Sheet facts = createSheet(workbook, FACT_VENTAS, FACT_VENTAS_COLUMNS, headerStyle);
      rowIdx = 1;
      for (FactSale fact : schema.facts()) {
        Row row = facts.createRow(rowIdx++);
        text(row, 0, fact.articulo());
        text(row, 1, fact.sucursal());
        number(row, 2, fact.ventaNeta());
        number(row, 3, fact.ventaBruta());
        number(row, 4, fact.ventaDevolucion());
        number(row, 5, fact.cantidad());
      }

      try (OutputStream os = Files.newOutputStream(target)) {
        workbook.write(os);
      }
    }

    log.info(
        "Workbook written to {} ({} items, {} branches, {} fact rows)",
        target,
        schema.items().size(),
        schema.branches().size(),
        schema.facts().size());
    return List.of(target);
  }

  private Sheet createSheet(
      SXSSFWorkbook workbook, String name, List<String> columns, CellStyle headerStyle) {
    Sheet sheet = workbook.createSheet(name);
    Row header = sheet.createRow(0);
    for (int i = 0; i < columns.size(); i++) {
      Cell cell = header.createCell(i);
      cell.setCellValue(columns.get(i));
      cell.setCellStyle(headerStyle);
    }
    return sheet;
  }

  private void text(Row row, int column, String value) {
    row.createCell(column).setCellValue(value);
  }

  private void number(Row row, int column, BigDecimal value) {
    if (value != null) {
      row.createCell(column).setCellValue(value.doubleValue());
    }
  }
}
