package com.ospicorp.tagsync.series.report;

/**
 * Problems the pipeline recovers from locally. None of these abort a run; the only fatal
 * outcome is an empty dataset.
 */
public enum DiagnosticKind {
  ROW_DROPPED,
  FILTER_SKIPPED,
  WINDOW_BOUND_IGNORED,
  FREQUENCY_FALLBACK,
  PERIOD_DEFAULTED,
  RESAMPLE_SKIPPED,
  STATS_IGNORED,
  RESAMPLE_FAILED
}
