package com.ospicorp.tagsync.series.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The aligned output: one row per master grid timestamp, one {@code double} column per series
 * statistic. Columns are appended in order while the table is assembled.
 */
public final class Table {
  public static final double SENTINEL = 0.0;

  private final String timestampLabel;
  private final List<LocalDateTime> index;
  private final List<String> columns = new ArrayList<>();
  private final List<double[]> cells = new ArrayList<>();

  public Table(String timestampLabel, List<LocalDateTime> index) {
    this.timestampLabel = timestampLabel;
    this.index = List.copyOf(index);
  }

  public void appendColumn(String label, double[] values) {
    if (values.length != index.size()) {
      throw new IllegalArgumentException("Column " + label + " has " + values.length
          + " cells for " + index.size() + " rows");
    }
    if (columns.contains(label)) {
      throw new IllegalArgumentException("Duplicate column " + label);
    }
    columns.add(label);
    cells.add(values.clone());
  }

  public String timestampLabel() {
    return timestampLabel;
  }

  public List<LocalDateTime> index() {
    return index;
  }

  public List<String> columns() {
    return Collections.unmodifiableList(columns);
  }

  public int rowCount() {
    return index.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public double get(int row, int column) {
    return cells.get(column)[row];
  }

  public double[] column(String label) {
    int position = columns.indexOf(label);
    if (position < 0) {
      throw new IllegalArgumentException("Unknown column " + label);
    }
    return cells.get(position).clone();
  }

  public double[] row(int row) {
    double[] out = new double[cells.size()];
    for (int c = 0; c < cells.size(); c++) {
      out[c] = cells.get(c)[row];
    }
    return out;
  }
}
