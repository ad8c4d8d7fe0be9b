package com.foo.pareto.service.pipeline.sniff;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one tabular sales export whose header row position and text encoding are unknown.
 *
 * <p>Implementations are best-effort: when no candidate layout looks like a sales table they
 * may still return a table read with a default layout, flagged with {@link
 * SniffResult#fallback()}. Callers must not treat a returned table as schema-validated; the
 * column normalizer is the stage that enforces the required columns.
 */
public interface HeaderSniffer {

  /**
   * @throws com.foo.pareto.exception.SalesFileParseException if not even the default layout
   *     can be read
   * @throws IOException if the file cannot be opened
   */
  SniffResult sniff(Path file) throws IOException;
}
