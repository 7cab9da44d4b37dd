package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.model.RawRecord;
import java.util.List;

/**
 * Everything the {@link SeriesBuilder} needs for one instrument. Labels may be {@code null} to
 * take the defaults of {@link com.ospicorp.tagsync.series.model.TimeSeries}.
 */
public record SeriesDefinition(String name, String timestampLabel, String valueLabel,
    List<RawRecord> records, String valueFilter, WindowBounds window) {

  public SeriesDefinition {
    records = List.copyOf(records);
    window = window != null ? window : WindowBounds.unbounded();
  }

  public static SeriesDefinition of(String name, List<RawRecord> records) {
    return new SeriesDefinition(name, null, null, records, null, null);
  }
}
