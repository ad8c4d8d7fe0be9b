package com.foo.pareto.report;

import com.foo.pareto.model.ConsistencyCheck;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Per-run collector handed to each pipeline stage. Stages record counts, decisions and
 * warnings here in addition to logging them, so a run can be inspected (and tested) without
 * parsing log output.
 */
@Data
public class PipelineReport {

  private final List<FileOutcome> files = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  private int rowsConsolidated;

  private String totalColumn;
  private boolean totalColumnMissing;
  private int rowsWithoutArticulo;
  private int summaryRowsRemoved;
  private int unparsableTotalCells;
  private int rowsClean;

  private int factRows;
  private int itemsAggregated;
  private int itemsRanked;
  private int itemsWithoutPositiveSales;
  private int branches;
  private ConsistencyCheck consistencyCheck;

  private List<String> outputFiles = new ArrayList<>();

  public void addFile(FileOutcome outcome) {
    files.add(outcome);
  }

  public void addWarning(String warning) {
    warnings.add(warning);
  }

  public List<FileOutcome> getProcessedFiles() {
    return files.stream().filter(f -> f.status() == FileOutcome.Status.PROCESSED).toList();
  }

  public List<FileOutcome> getSkippedFiles() {
    return files.stream().filter(f -> f.status() == FileOutcome.Status.SKIPPED).toList();
  }
}
