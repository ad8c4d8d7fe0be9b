package com.foo.pareto.report;

import lombok.Builder;

/** What happened to one input file during consolidation. */
@Builder
public record FileOutcome(
    String fileName,
    String sucursal,
    Status status,
    String encoding,
    Integer headerOffset,
    String delimiter,
    boolean fallback,
    int rows,
    int columns,
    String errorKind,
    String message) {

  public enum Status {
    PROCESSED,
    SKIPPED
  }
}
