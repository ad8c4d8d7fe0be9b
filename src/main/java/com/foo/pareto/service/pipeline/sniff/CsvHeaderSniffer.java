package com.foo.pareto.service.pipeline.sniff;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.exception.SalesFileParseException;
import com.foo.pareto.model.RawTable;
import com.foo.pareto.util.HeaderTextUtil;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

/**
 * Tries every configured encoding, then every header offset (plus "no header"), then every
 * delimiter, and keeps the first table whose columns look like a sales export. When none does,
 * reads the file as UTF-8 with the header at the configured fallback offset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvHeaderSniffer implements HeaderSniffer {

  static final List<String> HEADER_KEYWORDS =
      List.of("art", "prod", "desc", "prec", "cant", "total");

  static final int MIN_COLUMNS = 3;
  static final int MIN_KEYWORD_COLUMNS = 2;

  private static final char BOM = '\uFEFF';

  private final ParetoEtlProperties properties;

  @Override
  public SniffResult sniff(Path file) throws IOException {
    for (Charset charset : properties.getCharsets()) {
      String content;
      try {
        content = readContent(file, charset);
      } catch (CharacterCodingException e) {
        log.debug("{}: not decodable as {}", file.getFileName(), charset);
        continue;
      }

      for (Integer headerOffset : candidateOffsets()) {
        for (char delimiter : properties.getDelimiters()) {
          try {
            RawTable table = parse(content, headerOffset, delimiter);
            log.debug(
                "{}: header={}, encoding={}, delimiter='{}' -> columns {}",
                file.getFileName(),
                headerOffset,
                charset,
                delimiter,
                table.getColumns());
            if (looksLikeSalesTable(table)) {
              log.info(
                  "{}: header={}, encoding={}, delimiter='{}'",
                  file.getFileName(),
                  headerOffset,
                  charset,
                  delimiter);
              return new SniffResult(table, charset, headerOffset, delimiter, false);
            }
          } catch (IllegalStateException e) {
            log.debug(
                "{}: header={}, encoding={}, delimiter='{}' rejected: {}",
                file.getFileName(),
                headerOffset,
                charset,
                delimiter,
                e.getMessage());
          }
        }
      }
    }

    return readWithFallback(file);
  }

  private SniffResult readWithFallback(Path file) throws IOException {
    int offset = properties.getFallbackHeaderOffset();
    char delimiter = properties.getDelimiters().get(0);
    log.warn("{}: no valid header found, using header={} (UTF-8)", file.getFileName(), offset);

    String content;
    try {
      content = readContent(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      throw new SalesFileParseException(file, "not valid UTF-8", e);
    }
    try {
      RawTable table = parse(content, offset, delimiter);
      return new SniffResult(table, StandardCharsets.UTF_8, offset, delimiter, true);
    } catch (IllegalStateException e) {
      throw new SalesFileParseException(file, e.getMessage(), e);
    }
  }

  private List<Integer> candidateOffsets() {
    List<Integer> offsets = new ArrayList<>(properties.getHeaderOffsets());
    if (properties.isTryHeaderless()) {
      offsets.add(null);
    }
    return offsets;
  }

  /** Strict decoding: malformed input for the charset fails with CharacterCodingException. */
  private String readContent(Path file, Charset charset) throws IOException {
    StringBuilder content = new StringBuilder();
    try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
      char[] buffer = new char[8192];
      int read;
      while ((read = reader.read(buffer)) != -1) {
        content.append(buffer, 0, read);
      }
    }
    if (content.length() > 0 && content.charAt(0) == BOM) {
      content.deleteCharAt(0);
    }
    return content.toString();
  }

  /**
   * Builds a table from already decoded content.
   *
   * @param headerOffset index of the header among non-blank records, null for no header
   * @throws IllegalStateException when the content does not fit the requested layout
   */
  RawTable parse(String content, Integer headerOffset, char delimiter) {
    List<CSVRecord> records = readRecords(content, delimiter);
    if (records.isEmpty()) {
      throw new IllegalStateException("no data");
    }

    List<String> columns;
    int firstDataRecord;
    if (headerOffset == null) {
      columns = new ArrayList<>();
      for (int i = 0; i < records.get(0).size(); i++) {
        columns.add(String.valueOf(i));
      }
      firstDataRecord = 0;
    } else {
      if (headerOffset >= records.size()) {
        throw new IllegalStateException(
            "header offset %d beyond %d line(s)".formatted(headerOffset, records.size()));
      }
      columns = headerLabels(records.get(headerOffset).toList());
      firstDataRecord = headerOffset + 1;
    }

    RawTable table = new RawTable(columns);
    for (int i = firstDataRecord; i < records.size(); i++) {
      List<String> values = records.get(i).toList();
      if (values.size() > columns.size()) {
        throw new IllegalStateException(
            "expected %d fields in line %d, saw %d"
                .formatted(columns.size(), records.get(i).getRecordNumber(), values.size()));
      }
      table.addRow(values);
    }
    return table;
  }

  private List<CSVRecord> readRecords(String content, char delimiter) {
    CSVFormat format =
        CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setIgnoreEmptyLines(true).build();
    try (CSVParser parser = CSVParser.parse(content, format)) {
      return parser.getRecords();
    } catch (IOException | UncheckedIOException e) {
      throw new IllegalStateException("malformed CSV: " + e.getMessage(), e);
    }
  }

  /** Blank labels become {@code Unnamed: i}; repeated labels get {@code .1}, {@code .2}. */
  private List<String> headerLabels(List<String> raw) {
    List<String> labels = new ArrayList<>(raw.size());
    Map<String, Integer> seen = new HashMap<>();
    for (int i = 0; i < raw.size(); i++) {
      String label = raw.get(i) == null || raw.get(i).isBlank() ? "Unnamed: " + i : raw.get(i);
      int count = seen.merge(label, 1, Integer::sum);
      labels.add(count == 1 ? label : label + "." + (count - 1));
    }
    return labels;
  }

  /**
   * At least one data row, at least three columns, and at least two columns whose
   * accent-stripped lowercase label contains a sales keyword.
   */
  static boolean looksLikeSalesTable(RawTable table) {
    if (table.isEmpty() || table.getColumns().size() < MIN_COLUMNS) {
      return false;
    }
    long keywordColumns =
        table.getColumns().stream()
            .map(HeaderTextUtil::matchKey)
            .filter(label -> HEADER_KEYWORDS.stream().anyMatch(label::contains))
            .count();
    return keywordColumns >= MIN_KEYWORD_COLUMNS;
  }
}
