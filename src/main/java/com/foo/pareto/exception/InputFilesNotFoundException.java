package com.foo.pareto.exception;

import java.nio.file.Path;
import lombok.Getter;

/** No input file could be located; the run cannot start. */
@Getter
public class InputFilesNotFoundException extends RuntimeException {

  private final Path directory;
  private final String filePattern;

  public InputFilesNotFoundException(Path directory, String filePattern) {
    super("No files matching '%s' found in %s".formatted(filePattern, directory));
    this.directory = directory;
    this.filePattern = filePattern;
  }

  public InputFilesNotFoundException(Path directory, String filePattern, Throwable cause) {
    super("Cannot list files matching '%s' in %s".formatted(filePattern, directory), cause);
    this.directory = directory;
    this.filePattern = filePattern;
  }
}
