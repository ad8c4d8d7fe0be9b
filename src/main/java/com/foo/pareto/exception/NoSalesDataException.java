package com.foo.pareto.exception;

import java.util.List;
import lombok.Getter;

/** Consolidation produced no usable file or no usable row. */
@Getter
public class NoSalesDataException extends RuntimeException {

  private final List<String> skippedFiles;

  public NoSalesDataException(String message, List<String> skippedFiles) {
    super(skippedFiles.isEmpty() ? message : message + ". Skipped files: " + skippedFiles);
    this.skippedFiles = List.copyOf(skippedFiles);
  }
}
