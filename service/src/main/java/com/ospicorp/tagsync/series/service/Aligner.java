package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.model.MasterGrid;
import com.ospicorp.tagsync.series.model.SeriesColumn;
import com.ospicorp.tagsync.series.model.Table;
import com.ospicorp.tagsync.series.model.TimeSeries;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges series onto one master grid with a backward "as of" join: every grid point takes the
 * latest row at or before it. Grid points with no such row, or whose row has no value, hold
 * {@link Table#SENTINEL}.
 */
public final class Aligner {
  public static final long DEFAULT_MAX_ROWS = 10_000_000L;
  public static final String TIMESTAMP_LABEL = "timestamp";

  private static final Logger log = LoggerFactory.getLogger(Aligner.class);

  private Aligner() {
  }

  public static Table align(List<TimeSeries> series, WindowBounds window, Duration period) {
    return align(series, window, period, DEFAULT_MAX_ROWS);
  }

  public static Table align(List<TimeSeries> series, WindowBounds window, Duration period,
      long maxRows) {
    if (period == null || period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("Alignment period must be positive, was " + period);
    }
    WindowBounds bounds = window != null ? window : WindowBounds.unbounded();
    List<TimeSeries> ordered = series.stream()
        .sorted(Comparator.comparing(TimeSeries::name))
        .toList();

    LocalDateTime globalStart = null;
    LocalDateTime globalEnd = null;
    for (TimeSeries ts : ordered) {
      if (ts.isEmpty()) {
        continue;
      }
      if (globalStart == null || ts.first().isBefore(globalStart)) {
        globalStart = ts.first();
      }
      if (globalEnd == null || ts.last().isAfter(globalEnd)) {
        globalEnd = ts.last();
      }
    }
    if (globalStart == null) {
      throw new EmptyDatasetException("None of the " + series.size()
          + " series has any samples to align");
    }
    if (bounds.start() != null && bounds.start().isAfter(globalStart)) {
      globalStart = bounds.start();
    }
    if (bounds.end() != null && bounds.end().isBefore(globalEnd)) {
      globalEnd = bounds.end();
    }
    if (globalStart.isAfter(globalEnd)) {
      throw new EmptyDatasetException("Alignment window is empty: start " + globalStart
          + " is after end " + globalEnd);
    }

    LocalDateTime gridStart = TimeGrid.floor(globalStart, TimeGrid.midnightOf(globalStart), period);
    long rows;
    try {
      rows = MasterGrid.pointCount(gridStart, globalEnd, period);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("Alignment window " + gridStart + " to " + globalEnd
          + " is too wide to step at " + ResamplePeriods.format(period), ex);
    }
    if (rows > maxRows) {
      throw new IllegalArgumentException("Aligning " + gridStart + " to " + globalEnd + " at "
          + ResamplePeriods.format(period) + " needs " + rows + " rows, above the limit of "
          + maxRows);
    }
    MasterGrid grid = new MasterGrid(gridStart, globalEnd, period);
    List<LocalDateTime> timestamps = grid.timestamps();
    Table table = new Table(TIMESTAMP_LABEL, timestamps);

    Set<String> usedLabels = new HashSet<>();
    for (TimeSeries ts : ordered) {
      for (SeriesColumn column : ts.columns()) {
        table.appendColumn(uniqueLabel(column.label(), usedLabels),
            asOf(ts.index(), column.values(), timestamps));
      }
    }
    log.info("Aligned {} series into {} rows x {} columns from {} to {} every {}",
        ordered.size(), table.rowCount(), table.columnCount(), gridStart, globalEnd,
        ResamplePeriods.format(period));
    return table;
  }

  private static double[] asOf(List<LocalDateTime> index, double[] values,
      List<LocalDateTime> grid) {
    double[] out = new double[grid.size()];
    int cursor = -1;
    for (int i = 0; i < grid.size(); i++) {
      LocalDateTime point = grid.get(i);
      while (cursor + 1 < index.size() && !index.get(cursor + 1).isAfter(point)) {
        cursor++;
      }
      double value = cursor >= 0 ? values[cursor] : Double.NaN;
      out[i] = Double.isNaN(value) ? Table.SENTINEL : value;
    }
    return out;
  }

  private static String uniqueLabel(String label, Set<String> used) {
    String candidate = label;
    int suffix = 2;
    while (!used.add(candidate)) {
      candidate = label + "_" + suffix++;
    }
    return candidate;
  }
}
