package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.ingest.SourceLayout;

/**
 * Options for one alignment run. Text fields may be {@code null} or blank to take the defaults:
 * no resampling, mean statistics, no filter, an open window and the layout's (or the configured)
 * timestamp format.
 */
public record AlignmentRequest(SourceLayout layout, String resample, String stats,
    String valueFilter, String start, String end, String timeFormat) {

  public static AlignmentRequest of(SourceLayout layout) {
    return new AlignmentRequest(layout, null, null, null, null, null, null);
  }
}
