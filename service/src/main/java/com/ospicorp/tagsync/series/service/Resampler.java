package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.model.MasterGrid;
import com.ospicorp.tagsync.series.model.ResampleSpec;
import com.ospicorp.tagsync.series.model.Sample;
import com.ospicorp.tagsync.series.model.SeriesColumn;
import com.ospicorp.tagsync.series.model.Stat;
import com.ospicorp.tagsync.series.model.TimeSeries;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brings a series to a target period. Upsampling carries the latest sample forward onto a finer
 * grid; downsampling reduces right-closed, right-labelled intervals to the requested statistics.
 * Grids are anchored at midnight of the first sample's day.
 *
 * <p>A series that cannot be resampled is left as it was and the reason is reported.
 */
public final class Resampler {
  public static final long DEFAULT_MAX_POINTS = 10_000_000L;

  private Resampler() {
  }

  public static TimeSeries resample(TimeSeries series, ResampleSpec spec,
      ProcessingReport report) {
    return resample(series, spec, report, DEFAULT_MAX_POINTS);
  }

  public static TimeSeries resample(TimeSeries series, ResampleSpec spec,
      ProcessingReport report, long maxPoints) {
    Duration target = spec.targetPeriod();
    Duration current = series.period();
    if (target == null || target.isZero() || target.isNegative()) {
      report.warn(DiagnosticKind.RESAMPLE_FAILED, series.name(),
          "Target period " + target + " is not positive; series left unchanged");
      return series;
    }
    if (current == null) {
      report.warn(DiagnosticKind.RESAMPLE_FAILED, series.name(),
          "Series period is unknown; series left unchanged");
      return series;
    }
    if (target.equals(current)) {
      report.info(DiagnosticKind.RESAMPLE_SKIPPED, series.name(),
          "Already at " + ResamplePeriods.format(target));
      return series;
    }
    if (series.isEmpty()) {
      report.info(DiagnosticKind.RESAMPLE_SKIPPED, series.name(), "No samples to resample");
      return series;
    }
    try {
      if (target.compareTo(current) < 0) {
        upsample(series, spec, report, maxPoints);
      } else {
        downsample(series, spec, report, maxPoints);
      }
    } catch (ArithmeticException ex) {
      report.warn(DiagnosticKind.RESAMPLE_FAILED, series.name(),
          "Target period " + ResamplePeriods.format(target) + " is incompatible with the series: "
              + ex.getMessage());
    }
    return series;
  }

  private static void upsample(TimeSeries series, ResampleSpec spec, ProcessingReport report,
      long maxPoints) {
    Duration target = spec.targetPeriod();
    LocalDateTime first = series.first();
    LocalDateTime gridStart = TimeGrid.floor(first, TimeGrid.midnightOf(first), target);
    if (!fits(series, gridStart, series.last(), target, maxPoints, report)) {
      return;
    }
    if (!spec.hasDefaultStats()) {
      report.warn(DiagnosticKind.STATS_IGNORED, series.name(),
          "Statistics " + spec.stats() + " apply to downsampling only; carrying values forward");
    }

    MasterGrid grid = new MasterGrid(gridStart, series.last(), target);
    List<Sample> samples = series.samples();
    int size = grid.size();
    List<LocalDateTime> index = new ArrayList<>(size);
    double[] values = new double[size];
    int cursor = -1;
    for (int i = 0; i < size; i++) {
      LocalDateTime point = grid.get(i);
      while (cursor + 1 < samples.size() && !samples.get(cursor + 1).timestamp().isAfter(point)) {
        cursor++;
      }
      index.add(point);
      values[i] = cursor >= 0 ? samples.get(cursor).value() : Double.NaN;
    }

    SeriesColumn primary = series.primaryColumn();
    series.replaceData(index, List.of(new SeriesColumn(primary.stat(), primary.label(), values)),
        target);
  }

  private static void downsample(TimeSeries series, ResampleSpec spec, ProcessingReport report,
      long maxPoints) {
    Duration target = spec.targetPeriod();
    LocalDateTime anchor = TimeGrid.midnightOf(series.first());
    LocalDateTime firstLabel = TimeGrid.ceil(series.first(), anchor, target);
    LocalDateTime lastLabel = TimeGrid.ceil(series.last(), anchor, target);
    if (!fits(series, firstLabel, lastLabel, target, maxPoints, report)) {
      return;
    }

    MasterGrid grid = new MasterGrid(firstLabel, lastLabel, target);
    int size = grid.size();
    Interval[] intervals = new Interval[size];
    long step = target.toNanos();
    for (Sample sample : series.samples()) {
      LocalDateTime label = TimeGrid.ceil(sample.timestamp(), anchor, target);
      int slot = Math.toIntExact(Duration.between(firstLabel, label).toNanos() / step);
      if (intervals[slot] == null) {
        intervals[slot] = new Interval();
      }
      intervals[slot].add(sample.value());
    }

    List<SeriesColumn> columns = new ArrayList<>(spec.stats().size());
    for (Stat stat : spec.stats()) {
      double[] values = new double[size];
      Arrays.fill(values, Double.NaN);
      for (int i = 0; i < size; i++) {
        if (intervals[i] != null) {
          values[i] = intervals[i].get(stat);
        }
      }
      columns.add(new SeriesColumn(stat, stat.columnLabel(series.name(), series.valueLabel()),
          values));
    }
    series.replaceData(grid.timestamps(), columns, target);
  }

  private static boolean fits(TimeSeries series, LocalDateTime start, LocalDateTime end,
      Duration target, long maxPoints, ProcessingReport report) {
    long points = MasterGrid.pointCount(start, end, target);
    if (points > maxPoints) {
      report.warn(DiagnosticKind.RESAMPLE_FAILED, series.name(),
          "Resampling to " + ResamplePeriods.format(target) + " needs " + points
              + " points, above the limit of " + maxPoints + "; series left unchanged");
      return false;
    }
    return true;
  }

  // Running reduction of one interval; mean and variance by Welford's method.
  private static final class Interval {
    private long count;
    private double last;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double mean;
    private double m2;

    void add(double value) {
      count++;
      last = value;
      min = Math.min(min, value);
      max = Math.max(max, value);
      double delta = value - mean;
      mean += delta / count;
      m2 += delta * (value - mean);
    }

    double get(Stat stat) {
      return switch (stat) {
        case VALUE -> last;
        case MIN -> min;
        case MAX -> max;
        case MEAN -> mean;
        case STD_DEV -> Math.sqrt(m2 / count);
      };
    }
  }
}
