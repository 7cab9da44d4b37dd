package com.ospicorp.tagsync.ingest;

import com.ospicorp.tagsync.series.model.RawRecord;
import java.util.List;

/**
 * The rows of one instrument cut out of a source file. Labels are {@code null} when the layout
 * does not name them.
 */
public record InstrumentSource(String name, String timestampLabel, String valueLabel,
    List<RawRecord> records) {

  public InstrumentSource {
    records = List.copyOf(records);
  }
}
