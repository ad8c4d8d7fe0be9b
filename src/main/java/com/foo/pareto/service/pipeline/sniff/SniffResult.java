package com.foo.pareto.service.pipeline.sniff;

import com.foo.pareto.model.RawTable;
import java.nio.charset.Charset;

/**
 * @param headerOffset index of the header among the non-blank lines, or {@code null} when every
 *     line was read as data
 * @param fallback true when no candidate layout validated and the default one was used
 */
public record SniffResult(
    RawTable table, Charset charset, Integer headerOffset, char delimiter, boolean fallback) {}
