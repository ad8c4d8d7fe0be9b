package com.foo.pareto.service.pipeline.export;

import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_ARTICULOS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_ARTICULOS_COLUMNS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_SUCURSALES;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.DIM_SUCURSALES_COLUMNS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.FACT_VENTAS;
import static com.foo.pareto.service.pipeline.export.StarSchemaColumns.FACT_VENTAS_COLUMNS;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.config.ParetoEtlProperties.ExportFormat;
import com.foo.pareto.model.BranchDimension;
import com.foo.pareto.model.FactSale;
import com.foo.pareto.model.ItemDimension;
import com.foo.pareto.model.StarSchema;
import com.foo.pareto.util.DecimalUtil;
import com.foo.pareto.util.SpreadsheetCellUtil;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

/**
 * Writes one UTF-8 CSV per table using the regional spreadsheet convention: {@code ;} between
 * fields and {@code ,} as decimal separator (both configurable).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvStarSchemaExporter implements StarSchemaExporter {

  private final ParetoEtlProperties properties;

  @Override
  public ExportFormat getFormat() {
    return ExportFormat.CSV;
  }

  @Override
  public List<Path> export(StarSchema schema, Path outputDirectory) throws IOException {
    Files.createDirectories(outputDirectory);
    CSVFormat format =
        CSVFormat.DEFAULT.builder()
            .setDelimiter(properties.getOutputDelimiter())
            .setRecordSeparator('\n')
            .build();
    log.info(
        "CSV format: delimiter='{}', decimal='{}'",
        properties.getOutputDelimiter(),
        properties.getOutputDecimalSeparator());

    Path items = outputDirectory.resolve(DIM_ARTICULOS + ".csv");
    try (CSVPrinter printer = open(items, format)) {
      printer.printRecord(DIM_ARTICULOS_COLUMNS);
      for (ItemDimension item : schema.items()) {
        printer.printRecord(
            item.articulo(),
            SpreadsheetCellUtil.sanitizeText(item.descripcion()),
            item.ranking(),
            item.clasificacionAbc().name(),
            number(item.ventaNetaTotal()),
            number(item.ventaBrutaTotal()),
            number(item.ventaDevolucionTotal()),
            number(item.tasaDevolucion()),
            number(item.porcentajeArticuloGlobal()),
            number(item.porcentajeAcumulado()));
      }
    }
    log.info("  {}: {} rows, primary key Articulo", items.getFileName(), schema.items().size());

    Path branches = outputDirectory.resolve(DIM_SUCURSALES + ".csv");
    try (CSVPrinter printer = open(branches, format)) {
      printer.printRecord(DIM_SUCURSALES_COLUMNS);
      for (BranchDimension branch : schema.branches()) {
        printer.printRecord(branch.sucursal(), branch.tipo().name());
      }
    }
    log.info(
        "  {}: {} rows, primary key Sucursal", branches.getFileName(), schema.branches().size());

    Path facts = outputDirectory.resolve(FACT_VENTAS + ".csv");
    try (CSVPrinter printer = open(facts, format)) {
      printer.printRecord(FACT_VENTAS_COLUMNS);
      for (FactSale fact : schema.facts()) {
        printer.printRecord(
            fact.articulo(),
            fact.sucursal(),
            number(fact.ventaNeta()),
            number(fact.ventaBruta()),
            number(fact.ventaDevolucion()),
            number(fact.cantidad()));
      }
    }
    log.info(
        "  {}: {} rows, foreign keys Articulo -> {}, Sucursal -> {}",
        facts.getFileName(),
        schema.facts().size(),
        DIM_ARTICULOS,
        DIM_SUCURSALES);

    return List.of(items, branches, facts);
  }

  private CSVPrinter open(Path file, CSVFormat format) throws IOException {
    BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    return new CSVPrinter(writer, format);
  }

  private String number(BigDecimal value) {
    return DecimalUtil.format(value, properties.getOutputDecimalSeparator());
  }
}
