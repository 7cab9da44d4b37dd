package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.model.TimeSeries;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates a series' native sampling period from its timestamp gaps and assigns it.
 *
 * <p>A gap that is the unique most common one and covers more than half of all gaps wins.
 * Otherwise the gap between the third and fourth samples is used (the first rows of an export are
 * often irregular), then the gap between the first two, and finally one second.
 */
public final class FrequencyInferencer {
  public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(1);

  private FrequencyInferencer() {
  }

  public static Duration infer(TimeSeries series, ProcessingReport report) {
    Duration period = estimate(series, report);
    if (period.isZero() || period.isNegative()) {
      report.warn(DiagnosticKind.FREQUENCY_FALLBACK, series.name(),
          "Inferred a non-positive period " + period + "; using " + DEFAULT_PERIOD);
      period = DEFAULT_PERIOD;
    }
    series.assignPeriod(period);
    return period;
  }

  private static Duration estimate(TimeSeries series, ProcessingReport report) {
    List<LocalDateTime> index = series.index();
    int n = index.size();
    if (n >= 3) {
      Duration dominant = dominantGap(index);
      if (dominant != null) {
        return dominant;
      }
    }
    if (n >= 4) {
      Duration gap = Duration.between(index.get(2), index.get(3));
      report.info(DiagnosticKind.FREQUENCY_FALLBACK, series.name(),
          "No dominant sample interval; using the gap between samples 3 and 4 (" + gap + ")");
      return gap;
    }
    if (n >= 2) {
      Duration gap = Duration.between(index.get(0), index.get(1));
      report.info(DiagnosticKind.FREQUENCY_FALLBACK, series.name(),
          "Too few samples for a dominant interval; using the first gap (" + gap + ")");
      return gap;
    }
    report.warn(DiagnosticKind.FREQUENCY_FALLBACK, series.name(),
        n + " sample(s), cannot infer a period; using " + DEFAULT_PERIOD);
    return DEFAULT_PERIOD;
  }

  private static Duration dominantGap(List<LocalDateTime> index) {
    Map<Duration, Integer> counts = new HashMap<>();
    int gaps = index.size() - 1;
    for (int i = 1; i < index.size(); i++) {
      Duration gap = Duration.between(index.get(i - 1), index.get(i));
      if (!gap.isZero()) {
        counts.merge(gap, 1, Integer::sum);
      }
    }
    Duration best = null;
    int bestCount = 0;
    boolean tied = false;
    for (Map.Entry<Duration, Integer> entry : counts.entrySet()) {
      int count = entry.getValue();
      if (count > bestCount) {
        best = entry.getKey();
        bestCount = count;
        tied = false;
      } else if (count == bestCount) {
        tied = true;
      }
    }
    if (best == null || tied || bestCount * 2 <= gaps) {
      return null;
    }
    return best;
  }
}
