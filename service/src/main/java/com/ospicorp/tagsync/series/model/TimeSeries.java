package com.ospicorp.tagsync.series.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One instrument's cleaned value stream: a strictly increasing timestamp index and one or more
 * value columns of the same length.
 *
 * <p>A freshly built series carries a single {@link Stat#VALUE} column of finite values and no
 * period. The period is assigned once inferred, and the data is replaced wholesale when the
 * series is resampled.
 */
public final class TimeSeries {
  public static final String DEFAULT_TIMESTAMP_LABEL = "timestamp";

  private final String name;
  private final String timestampLabel;
  private final String valueLabel;
  private final String valueFilter;
  private final LocalDateTime windowStart;
  private final LocalDateTime windowEnd;

  private List<LocalDateTime> index;
  private List<SeriesColumn> columns;
  private Duration period;

  public TimeSeries(String name, String timestampLabel, String valueLabel, List<Sample> samples,
      String valueFilter, LocalDateTime windowStart, LocalDateTime windowEnd) {
    this.name = Objects.requireNonNull(name, "name");
    this.timestampLabel = timestampLabel != null ? timestampLabel : DEFAULT_TIMESTAMP_LABEL;
    this.valueLabel = valueLabel != null ? valueLabel : name;
    this.valueFilter = valueFilter;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;

    List<LocalDateTime> timestamps = new ArrayList<>(samples.size());
    double[] values = new double[samples.size()];
    for (int i = 0; i < samples.size(); i++) {
      Sample sample = samples.get(i);
      if (!Double.isFinite(sample.value())) {
        throw new IllegalArgumentException(
            "Series " + name + " has a non-finite value at " + sample.timestamp());
      }
      timestamps.add(sample.timestamp());
      values[i] = sample.value();
    }
    this.index = checkIndex(timestamps);
    this.columns = List.of(new SeriesColumn(Stat.VALUE, this.valueLabel, values));
  }

  public static TimeSeries of(String name, List<Sample> samples) {
    return new TimeSeries(name, null, null, samples, null, null, null);
  }

  public String name() {
    return name;
  }

  public String timestampLabel() {
    return timestampLabel;
  }

  public String valueLabel() {
    return valueLabel;
  }

  public String valueFilter() {
    return valueFilter;
  }

  public LocalDateTime windowStart() {
    return windowStart;
  }

  public LocalDateTime windowEnd() {
    return windowEnd;
  }

  public Duration period() {
    return period;
  }

  public void assignPeriod(Duration period) {
    this.period = checkPeriod(period);
  }

  public List<LocalDateTime> index() {
    return index;
  }

  public List<SeriesColumn> columns() {
    return columns;
  }

  public Optional<SeriesColumn> column(Stat stat) {
    return columns.stream().filter(c -> c.stat() == stat).findFirst();
  }

  public SeriesColumn primaryColumn() {
    return columns.get(0);
  }

  public int size() {
    return index.size();
  }

  public boolean isEmpty() {
    return index.isEmpty();
  }

  public LocalDateTime first() {
    return index.isEmpty() ? null : index.get(0);
  }

  public LocalDateTime last() {
    return index.isEmpty() ? null : index.get(index.size() - 1);
  }

  /** Rows of the primary column that hold a value, in timestamp order. */
  public List<Sample> samples() {
    SeriesColumn primary = primaryColumn();
    List<Sample> out = new ArrayList<>(index.size());
    for (int i = 0; i < index.size(); i++) {
      if (primary.isPresent(i)) {
        out.add(new Sample(index.get(i), primary.values()[i]));
      }
    }
    return out;
  }

  public void replaceData(List<LocalDateTime> newIndex, List<SeriesColumn> newColumns,
      Duration newPeriod) {
    if (newColumns.isEmpty()) {
      throw new IllegalArgumentException("Series " + name + " needs at least one column");
    }
    for (SeriesColumn column : newColumns) {
      if (column.values().length != newIndex.size()) {
        throw new IllegalArgumentException("Column " + column.label() + " has "
            + column.values().length + " cells for " + newIndex.size() + " timestamps");
      }
    }
    this.index = checkIndex(new ArrayList<>(newIndex));
    this.columns = List.copyOf(newColumns);
    this.period = checkPeriod(newPeriod);
  }

  private List<LocalDateTime> checkIndex(List<LocalDateTime> timestamps) {
    for (int i = 1; i < timestamps.size(); i++) {
      if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
        throw new IllegalArgumentException("Series " + name
            + " timestamps must be strictly increasing, found " + timestamps.get(i - 1)
            + " then " + timestamps.get(i));
      }
    }
    return Collections.unmodifiableList(timestamps);
  }

  private Duration checkPeriod(Duration candidate) {
    if (candidate != null && (candidate.isZero() || candidate.isNegative())) {
      throw new IllegalArgumentException("Series " + name + " period must be positive");
    }
    return candidate;
  }

  @Override
  public String toString() {
    return "TimeSeries{name=" + name + ", period=" + period + ", rows=" + index.size()
        + ", start=" + first() + ", end=" + last() + "}";
  }
}
