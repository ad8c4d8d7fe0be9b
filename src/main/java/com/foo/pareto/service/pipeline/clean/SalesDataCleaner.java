package com.foo.pareto.service.pipeline.clean;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.exception.ColumnNormalizationException;
import com.foo.pareto.model.CanonicalColumn;
import com.foo.pareto.model.CleanSalesRow;
import com.foo.pareto.model.RawTable;
import com.foo.pareto.report.PipelineReport;
import com.foo.pareto.util.DecimalUtil;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SalesDataCleaner {

  /** Accepted names of the line-total column, in priority order. */
  public static final List<String> TOTAL_COLUMN_CANDIDATES =
      List.of("Total_precio", "Total precio", "Precio total", "Total_venta", "Total", "Importe");

  /**
   * Markers of spreadsheet summary lines. Matched as substrings, so an item described as
   * "TOTAL CLEAN KIT" is dropped too.
   */
  public static final List<String> SUMMARY_MARKERS =
      List.of("TOTAL", "GRAND TOTAL", "SUBTOTAL", "GRAN TOTAL", "TOTAL GENERAL");

  public static final String MISSING_DESCRIPTION = "SIN DESCRIPCION";

  private static final int UNPARSABLE_SAMPLES_LOGGED = 3;

  private static final Set<String> EMPTY_IDENTITIES = Set.of("", "NAN", "NONE");

  private final ParetoEtlProperties properties;

  /**
   * Types and filters consolidated rows: derives the net sale from the total column, coerces
   * numbers leniently (unparsable values become zero), canonicalizes item codes and drops rows
   * without an item code or that are subtotal/total lines.
   */
  public List<CleanSalesRow> clean(RawTable table, PipelineReport report) {
    log.info("Cleaning {} rows, columns {}", table.size(), table.getColumns());

    String totalColumn = resolveTotalColumn(table, report).orElse(null);

    boolean hasCantidad = table.hasColumn(CanonicalColumn.CANTIDAD.getLabel());
    if (!hasCantidad) {
      log.warn("Column 'Cantidad' not found, using 0");
    }
    boolean hasPrecio = table.hasColumn(CanonicalColumn.PRECIO.getLabel());
    boolean hasDescripcion = table.hasColumn(CanonicalColumn.DESCRIPCION.getLabel());
    if (!hasDescripcion) {
      log.warn("Column 'Descripcion' not found, using '{}'", MISSING_DESCRIPTION);
    }

    List<CleanSalesRow> rows = new ArrayList<>(table.size());
    int withoutArticulo = 0;
    int summaryRows = 0;
    List<String> unparsableTotals = new ArrayList<>();

    for (Map<String, String> raw : table.getRows()) {
      String articulo = canonical(raw.get(CanonicalColumn.ARTICULO.getLabel()));
      if (EMPTY_IDENTITIES.contains(articulo)) {
        withoutArticulo++;
        continue;
      }

      String descripcion =
          hasDescripcion
              ? StringUtils.defaultIfEmpty(
                  canonical(raw.get(CanonicalColumn.DESCRIPCION.getLabel())), MISSING_DESCRIPTION)
              : MISSING_DESCRIPTION;

      if (isSummaryRow(articulo) || (hasDescripcion && isSummaryRow(descripcion))) {
        summaryRows++;
        continue;
      }

      BigDecimal ventaNeta = BigDecimal.ZERO;
      if (totalColumn != null) {
        String rawTotal = raw.get(totalColumn);
        Optional<BigDecimal> parsed = DecimalUtil.tryParse(rawTotal);
        if (parsed.isPresent()) {
          ventaNeta = parsed.get();
        } else if (rawTotal != null) {
          unparsableTotals.add(rawTotal);
        }
      }

      rows.add(
          CleanSalesRow.builder()
              .articulo(articulo)
              .descripcion(descripcion)
              .sucursal(raw.get(CanonicalColumn.SUCURSAL.getLabel()))
              .cantidad(
                  hasCantidad
                      ? DecimalUtil.parseOrZero(raw.get(CanonicalColumn.CANTIDAD.getLabel()))
                      : BigDecimal.ZERO)
              .precio(
                  hasPrecio
                      ? DecimalUtil.parseOrZero(raw.get(CanonicalColumn.PRECIO.getLabel()))
                      : null)
              .ventaNeta(ventaNeta)
              .build());
    }

    log.info("  Rows without item code removed: {}", withoutArticulo);
    if (summaryRows > 0) {
      log.warn("  {} TOTAL/SUBTOTAL row(s) removed", summaryRows);
    } else {
      log.info("  No TOTAL/SUBTOTAL rows found");
    }
    if (!unparsableTotals.isEmpty()) {
      log.warn(
          "  {} non-numeric '{}' value(s) counted as 0, e.g. {}",
          unparsableTotals.size(),
          totalColumn,
          unparsableTotals.stream().distinct().limit(UNPARSABLE_SAMPLES_LOGGED).toList());
      report.addWarning(
          "%d non-numeric value(s) in total column '%s' counted as 0"
              .formatted(unparsableTotals.size(), totalColumn));
    }
    log.info("Clean rows: {}", rows.size());

    report.setRowsWithoutArticulo(withoutArticulo);
    report.setSummaryRowsRemoved(summaryRows);
    report.setUnparsableTotalCells(unparsableTotals.size());
    report.setRowsClean(rows.size());
    return rows;
  }

  /**
   * Exact candidate first, then the first column whose name contains "total". When neither
   * exists every net sale is zero, which later fails the Pareto ranking; with {@code
   * fail-on-missing-total-column} the run stops here instead.
   */
  Optional<String> resolveTotalColumn(RawTable table, PipelineReport report) {
    Optional<String> exact = TOTAL_COLUMN_CANDIDATES.stream().filter(table::hasColumn).findFirst();
    if (exact.isPresent()) {
      log.info("  Total column: '{}'", exact.get());
      report.setTotalColumn(exact.get());
      return exact;
    }

    Optional<String> similar =
        table.getColumns().stream()
            .filter(c -> c.toLowerCase(Locale.ROOT).contains("total"))
            .findFirst();
    if (similar.isPresent()) {
      log.warn("  Using similar column as total: '{}'", similar.get());
      report.setTotalColumn(similar.get());
      report.addWarning("Total column matched by substring: " + similar.get());
      return similar;
    }

    if (properties.isFailOnMissingTotalColumn()) {
      throw new ColumnNormalizationException(
          "consolidated sales", "Total_precio", table.getColumns(), TOTAL_COLUMN_CANDIDATES);
    }
    log.error("  No total column found in {}. Net sales set to 0.", table.getColumns());
    report.setTotalColumnMissing(true);
    report.addWarning("No total column found; every net sale is 0");
    return Optional.empty();
  }

  private static boolean isSummaryRow(String value) {
    return SUMMARY_MARKERS.stream().anyMatch(value::contains);
  }

  private static String canonical(String value) {
    return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
  }
}
