package com.foo.pareto.service.pipeline.consolidate;

import com.foo.pareto.exception.ColumnNormalizationException;
import com.foo.pareto.exception.NoSalesDataException;
import com.foo.pareto.exception.SalesFileParseException;
import com.foo.pareto.model.CanonicalColumn;
import com.foo.pareto.model.RawTable;
import com.foo.pareto.report.FileOutcome;
import com.foo.pareto.report.PipelineReport;
import com.foo.pareto.service.pipeline.normalize.ColumnNormalizer;
import com.foo.pareto.service.pipeline.sniff.HeaderSniffer;
import com.foo.pareto.service.pipeline.sniff.SniffResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SalesFileConsolidator {

  private final HeaderSniffer headerSniffer;
  private final ColumnNormalizer columnNormalizer;

  /**
   * Sniffs and normalizes every file on its own, tags its rows with the branch named after the
   * file, and concatenates the results over the union of their columns.
   *
   * <p>A file that cannot be parsed or has no recognizable item column is logged, recorded in
   * the report and skipped.
   *
   * @throws NoSalesDataException if no file survives or the survivors hold no rows
   */
  public RawTable consolidate(List<Path> files, PipelineReport report) {
    List<RawTable> tables = new ArrayList<>();
    List<String> skipped = new ArrayList<>();

    for (Path file : files) {
      String fileName = file.getFileName().toString();
      String sucursal = branchName(file);
      log.info("Processing {}", fileName);

      try {
        SniffResult sniffed = headerSniffer.sniff(file);
        RawTable normalized = columnNormalizer.normalize(sniffed.table(), fileName);
        normalized.putConstantColumn(CanonicalColumn.SUCURSAL.getLabel(), sucursal);
        tables.add(normalized);

        if (sniffed.fallback()) {
          report.addWarning(fileName + ": header not detected, read with default layout");
        }
        report.addFile(
            FileOutcome.builder()
                .fileName(fileName)
                .sucursal(sucursal)
                .status(FileOutcome.Status.PROCESSED)
                .encoding(sniffed.charset().name())
                .headerOffset(sniffed.headerOffset())
                .delimiter(String.valueOf(sniffed.delimiter()))
                .fallback(sniffed.fallback())
                .rows(normalized.size())
                .columns(normalized.getColumns().size())
                .build());
        log.info(
            "  {}: {} rows, {} columns",
            sucursal,
            normalized.size(),
            normalized.getColumns().size());
      } catch (SalesFileParseException | IOException e) {
        skip(report, skipped, fileName, sucursal, "PARSE", e);
      } catch (ColumnNormalizationException e) {
        log.warn("  {}", e.getSuggestion());
        skip(report, skipped, fileName, sucursal, "SCHEMA", e);
      }
    }

    if (tables.isEmpty()) {
      throw new NoSalesDataException("No file could be loaded", skipped);
    }

    RawTable consolidated = RawTable.concat(tables);
    if (consolidated.isEmpty()) {
      throw new NoSalesDataException("Loaded files contain no rows", skipped);
    }

    report.setRowsConsolidated(consolidated.size());
    log.info(
        "Consolidated {} rows from {} file(s), columns {}",
        consolidated.size(),
        tables.size(),
        consolidated.getColumns());
    return consolidated;
  }

  /** Base name without extension, uppercased: {@code centro.csv} becomes {@code CENTRO}. */
  static String branchName(Path file) {
    return FilenameUtils.getBaseName(file.getFileName().toString()).toUpperCase(Locale.ROOT);
  }

  private void skip(
      PipelineReport report,
      List<String> skipped,
      String fileName,
      String sucursal,
      String errorKind,
      Exception e) {
    log.error("  Skipping {}: {}", fileName, e.getMessage());
    skipped.add(fileName);
    report.addFile(
        FileOutcome.builder()
            .fileName(fileName)
            .sucursal(sucursal)
            .status(FileOutcome.Status.SKIPPED)
            .errorKind(errorKind)
            .message(e.getMessage())
            .build());
  }
}
