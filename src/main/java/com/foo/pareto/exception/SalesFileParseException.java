package com.foo.pareto.exception;

import java.nio.file.Path;
import lombok.Getter;

/** A sales file could not be parsed, not even with the fallback header position. */
@Getter
public class SalesFileParseException extends RuntimeException {

  private final Path file;

  public SalesFileParseException(Path file, String reason) {
    super("Cannot parse %s: %s".formatted(file.getFileName(), reason));
    this.file = file;
  }

  public SalesFileParseException(Path file, String reason, Throwable cause) {
    super("Cannot parse %s: %s".formatted(file.getFileName(), reason), cause);
    this.file = file;
  }
}
