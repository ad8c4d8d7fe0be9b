package com.foo.pareto.exception;

import java.util.List;
import lombok.Getter;

/** A required column could not be inferred from the headers of a sales table. */
@Getter
public class ColumnNormalizationException extends RuntimeException {

  private final String sourceName;
  private final String requiredColumn;
  private final List<String> availableColumns;
  private final List<String> acceptedHints;

  public ColumnNormalizationException(
      String sourceName,
      String requiredColumn,
      List<String> availableColumns,
      List<String> acceptedHints) {
    super(buildMessage(sourceName, requiredColumn, availableColumns));
    this.sourceName = sourceName;
    this.requiredColumn = requiredColumn;
    this.availableColumns = List.copyOf(availableColumns);
    this.acceptedHints = List.copyOf(acceptedHints);
  }

  /** Operator-facing hint naming what a header has to contain to be recognized. */
  public String getSuggestion() {
    return "Check that %s has a column whose header contains one of %s"
        .formatted(sourceName, acceptedHints);
  }

  private static String buildMessage(
      String sourceName, String requiredColumn, List<String> availableColumns) {
    return "Column '%s' not found in %s. Available columns: %s"
        .formatted(requiredColumn, sourceName, availableColumns);
  }
}
