package com.foo.pareto.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loosely typed table as read from a sales export: ordered column labels and rows of cell
 * values keyed by label. A missing or blank cell is stored as {@code null}.
 *
 * <p>Instances are mutable and owned by a single pipeline stage at a time.
 */
public class RawTable {

  private final List<String> columns;
  private final List<Map<String, String>> rows;

  public RawTable(List<String> columns) {
    this.columns = new ArrayList<>(columns);
    this.rows = new ArrayList<>();
  }

  public List<String> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  public List<Map<String, String>> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /** Appends a row; values are taken positionally and missing trailing cells become null. */
  public void addRow(List<String> values) {
    Map<String, String> row = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String value = i < values.size() ? values.get(i) : null;
      row.put(columns.get(i), blankToNull(value));
    }
    rows.add(row);
  }

  public String get(int rowIndex, String column) {
    return rows.get(rowIndex).get(column);
  }

  /** Adds (or overwrites) a column holding the same value in every row. */
  public void putConstantColumn(String column, String value) {
    if (!columns.contains(column)) {
      columns.add(column);
    }
    for (Map<String, String> row : rows) {
      row.put(column, value);
    }
  }

  /**
   * Renames columns in one pass. Labels not present in the mapping are kept. When two source
   * labels map to the same target, the later source column wins and the earlier one keeps its
   * own label.
   */
  public RawTable renameColumns(Map<String, String> mapping) {
    Map<String, Integer> lastSourceIndexByTarget = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String target = mapping.get(columns.get(i));
      if (target != null) {
        lastSourceIndexByTarget.put(target, i);
      }
    }

    List<String> renamed = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      String source = columns.get(i);
      String target = mapping.get(source);
      boolean applies = target != null && lastSourceIndexByTarget.get(target) == i;
      renamed.add(applies ? target : source);
    }

    RawTable result = new RawTable(dedupe(renamed));
    for (Map<String, String> row : rows) {
      List<String> values = new ArrayList<>(columns.size());
      for (String source : columns) {
        values.add(row.get(source));
      }
      result.addRow(values);
    }
    return result;
  }

  /**
   * Concatenates tables taking the union of their columns in first-seen order. Cells of
   * columns a table does not have are null.
   */
  public static RawTable concat(List<RawTable> tables) {
    Set<String> union = new LinkedHashSet<>();
    for (RawTable table : tables) {
      union.addAll(table.columns);
    }
    RawTable result = new RawTable(new ArrayList<>(union));
    for (RawTable table : tables) {
      for (Map<String, String> row : table.rows) {
        List<String> values = new ArrayList<>(union.size());
        for (String column : union) {
          values.add(row.get(column));
        }
        result.addRow(values);
      }
    }
    return result;
  }

  private static List<String> dedupe(List<String> labels) {
    // a target label can collide with an untouched source label of the same name
    Map<String, Integer> seen = new HashMap<>();
    List<String> result = new ArrayList<>(labels.size());
    for (String label : labels) {
      int count = seen.merge(label, 1, Integer::sum);
      result.add(count == 1 ? label : label + "." + (count - 1));
    }
    return result;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
