package com.ospicorp.tagsync.ingest;

import com.ospicorp.tagsync.series.model.RawRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Column layouts of the exports that can be ingested.
 *
 * <ul>
 *   <li>{@link #HISTORICAL_TREND}: column pairs {@code <Tag> Time, <Tag> ValueY}, one pair per
 *       instrument, timestamps not synchronized between pairs.</li>
 *   <li>{@link #ARCHIVE}: {@code ValueId,Timestamp,value,quality,flags}, one row per sample.</li>
 *   <li>{@link #TIME_NORMALIZED}: a shared timestamp column followed by one column per
 *       instrument.</li>
 * </ul>
 */
public enum SourceLayout {
  HISTORICAL_TREND(null, "t", "trend", "historical_trend") {
    @Override
    List<InstrumentSource> extract(SourceTable table) {
      List<String> header = table.header();
      if (header.size() < 2) {
        throw new SourceFormatException(
            "Historical trend files need at least one time/value column pair");
      }
      if (header.size() % 2 != 0) {
        log.warn("Ignoring unpaired trailing column '{}'", header.get(header.size() - 1));
      }
      List<InstrumentSource> out = new ArrayList<>();
      for (int column = 0; column + 1 < header.size(); column += 2) {
        String name = instrumentName(tagOf(header.get(column)), column);
        out.add(new InstrumentSource(name, "timestamp_" + name, "value_" + name,
            pairRecords(table, name, column, column + 1)));
      }
      return out;
    }
  },

  ARCHIVE("%Y-%m-%d %H:%M:%S.%f", "a", "archive") {
    @Override
    List<InstrumentSource> extract(SourceTable table) {
      List<String> header = table.header();
      if (header.size() < 3) {
        throw new SourceFormatException(
            "Archive files need ValueId, Timestamp and value columns");
      }
      int idColumn = find(header, "valueid", 0);
      int timeColumn = find(header, "timestamp", 1);
      int valueColumn = find(header, "value", 2);
      Map<String, List<RawRecord>> grouped = new LinkedHashMap<>();
      for (int row = 0; row < table.rowCount(); row++) {
        String id = table.cell(row, idColumn);
        if (id.isEmpty()) {
          continue;
        }
        String name = instrumentName(id, idColumn);
        grouped.computeIfAbsent(name, k -> new ArrayList<>())
            .add(new RawRecord(name, table.cell(row, timeColumn), table.cell(row, valueColumn)));
      }
      List<InstrumentSource> out = new ArrayList<>(grouped.size());
      grouped.forEach((name, records) -> out.add(new InstrumentSource(name, null, null, records)));
      return out;
    }
  },

  TIME_NORMALIZED(null, "n", "normalized", "time_normalized") {
    @Override
    List<InstrumentSource> extract(SourceTable table) {
      List<String> header = table.header();
      if (header.size() < 2) {
        throw new SourceFormatException(
            "Time-normalized files need a timestamp column and at least one value column");
      }
      List<InstrumentSource> out = new ArrayList<>();
      for (int column = 1; column < header.size(); column++) {
        String name = instrumentName(header.get(column), column);
        out.add(new InstrumentSource(name, null, null, pairRecords(table, name, 0, column)));
      }
      return out;
    }
  };

  private static final Logger log = LoggerFactory.getLogger(SourceLayout.class);

  private final String defaultTimeFormat;
  private final List<String> codes;

  SourceLayout(String defaultTimeFormat, String... codes) {
    this.defaultTimeFormat = defaultTimeFormat;
    this.codes = List.of(codes);
  }

  abstract List<InstrumentSource> extract(SourceTable table);

  /** Timestamp format this export always uses, or {@code null} when it varies by site. */
  public String defaultTimeFormat() {
    return defaultTimeFormat;
  }

  /**
   * Splits a source table into one entry per instrument. An instrument that appears more than
   * once keeps its first position and gets the later rows appended.
   */
  public List<InstrumentSource> split(SourceTable table) {
    Map<String, InstrumentSource> merged = new LinkedHashMap<>();
    for (InstrumentSource source : extract(table)) {
      InstrumentSource existing = merged.get(source.name());
      if (existing == null) {
        merged.put(source.name(), source);
        continue;
      }
      log.info("Instrument {} appears more than once; appending {} rows", source.name(),
          source.records().size());
      List<RawRecord> records = new ArrayList<>(existing.records());
      records.addAll(source.records());
      merged.put(source.name(), new InstrumentSource(existing.name(), existing.timestampLabel(),
          existing.valueLabel(), records));
    }
    return List.copyOf(merged.values());
  }

  public static SourceLayout fromCode(String code) {
    if (code != null) {
      String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
      for (SourceLayout layout : values()) {
        if (layout.codes.contains(normalized)) {
          return layout;
        }
      }
    }
    throw new IllegalArgumentException("Unknown source layout '" + code + "'");
  }

  static String instrumentName(String text, int column) {
    String name = text == null ? "" : text.trim().replace(' ', '_').replace('-', '_');
    return name.isEmpty() ? "column_" + (column + 1) : name;
  }

  // "Tank 1 Level Time" is tag "Tank 1 Level"; the last word names the column kind.
  static String tagOf(String header) {
    String trimmed = header.trim();
    int space = trimmed.lastIndexOf(' ');
    return space > 0 ? trimmed.substring(0, space) : trimmed;
  }

  private static List<RawRecord> pairRecords(SourceTable table, String name, int timeColumn,
      int valueColumn) {
    List<RawRecord> records = new ArrayList<>(table.rowCount());
    for (int row = 0; row < table.rowCount(); row++) {
      String time = table.cell(row, timeColumn);
      String value = table.cell(row, valueColumn);
      // pairs run out at different rows; the rest of a short pair is blank
      if (time.isEmpty() && value.isEmpty()) {
        continue;
      }
      records.add(new RawRecord(name, time, value));
    }
    return records;
  }

  private static int find(List<String> header, String label, int fallback) {
    for (int i = 0; i < header.size(); i++) {
      String cell = header.get(i).trim().toLowerCase(Locale.ROOT);
      if (cell.equals(label) || cell.startsWith(label + " ")) {
        return i;
      }
    }
    return fallback;
  }
}
