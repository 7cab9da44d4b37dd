package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.model.RawRecord;
import com.ospicorp.tagsync.series.model.Sample;
import com.ospicorp.tagsync.series.model.TimeSeries;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns one instrument's raw rows into a clean {@link TimeSeries}: parsed, rounded to the
 * millisecond, sorted, de-duplicated (last row wins), value filtered and clipped to the window.
 * Row level problems never fail the build; they are summarized in the report.
 */
public class SeriesBuilder {
  public static final String DEFAULT_TIME_FORMAT = "%m/%d/%Y %I:%M:%S %p";

  private static final Logger log = LoggerFactory.getLogger(SeriesBuilder.class);

  private final String timeFormat;
  private final DateTimeFormatter formatter;
  private final FlexibleDateTimeParser fallback;

  public SeriesBuilder(String timeFormat, FlexibleDateTimeParser fallback) {
    this.timeFormat = StringUtils.hasText(timeFormat) ? timeFormat : DEFAULT_TIME_FORMAT;
    this.formatter = StrftimeFormat.toFormatter(this.timeFormat);
    this.fallback = fallback;
  }

  public String timeFormat() {
    return timeFormat;
  }

  public TimeSeries build(SeriesDefinition definition, ProcessingReport report) {
    String name = definition.name();
    List<Sample> parsed = parseRows(name, definition.records(), report);

    List<Sample> rounded = new ArrayList<>(parsed.size());
    for (Sample sample : parsed) {
      rounded.add(new Sample(TimeGrid.roundToMillis(sample.timestamp()), sample.value()));
    }
    rounded.sort(Comparator.comparing(Sample::timestamp));
    List<Sample> unique = keepLastPerTimestamp(rounded);

    List<Sample> filtered = applyFilter(name, definition.valueFilter(), unique, report);

    WindowBounds window = definition.window();
    List<Sample> clipped = window.isUnbounded()
        ? filtered
        : filtered.stream().filter(s -> window.contains(s.timestamp())).toList();

    log.debug("Series {}: {} raw rows, {} parsed, {} unique, {} after filter, {} in window",
        name, definition.records().size(), parsed.size(), unique.size(), filtered.size(),
        clipped.size());
    return new TimeSeries(name, definition.timestampLabel(), definition.valueLabel(), clipped,
        definition.valueFilter(), window.start(), window.end());
  }

  private List<Sample> parseRows(String name, List<RawRecord> records, ProcessingReport report) {
    List<Sample> samples = new ArrayList<>(records.size());
    int dropped = 0;
    String firstProblem = null;
    for (int row = 0; row < records.size(); row++) {
      RawRecord record = records.get(row);
      Optional<LocalDateTime> timestamp = parseTimestamp(record.rawTimestamp());
      double value = parseValue(record.rawValue());
      if (timestamp.isPresent() && Double.isFinite(value)) {
        samples.add(new Sample(timestamp.get(), value));
        continue;
      }
      dropped++;
      if (firstProblem == null) {
        firstProblem = "row " + (row + 1) + " ('" + record.rawTimestamp() + "', '"
            + record.rawValue() + "'): "
            + (timestamp.isEmpty() ? "unparsable timestamp" : "non-numeric value");
      }
    }
    if (dropped > 0) {
      report.warn(DiagnosticKind.ROW_DROPPED, name,
          "Dropped " + dropped + " of " + records.size() + " rows; first was " + firstProblem);
    }
    return samples;
  }

  private Optional<LocalDateTime> parseTimestamp(String text) {
    if (!StringUtils.hasText(text)) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    try {
      return Optional.of(LocalDateTime.from(formatter.parse(trimmed)));
    } catch (DateTimeException ex) {
      return fallback.parseDateTime(trimmed);
    }
  }

  private static double parseValue(String text) {
    if (!StringUtils.hasText(text)) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException ex) {
      return Double.NaN;
    }
  }

  // Input is sorted; of equal timestamps the later row in the file is kept.
  private static List<Sample> keepLastPerTimestamp(List<Sample> sorted) {
    List<Sample> unique = new ArrayList<>(sorted.size());
    for (Sample sample : sorted) {
      int last = unique.size() - 1;
      if (last >= 0 && unique.get(last).timestamp().equals(sample.timestamp())) {
        unique.set(last, sample);
      } else {
        unique.add(sample);
      }
    }
    return unique;
  }

  private static List<Sample> applyFilter(String name, String expression, List<Sample> samples,
      ProcessingReport report) {
    if (!StringUtils.hasText(expression)) {
      return samples;
    }
    ValueFilter filter;
    try {
      filter = ValueFilter.compile(expression);
    } catch (FilterSyntaxException ex) {
      report.warn(DiagnosticKind.FILTER_SKIPPED, name,
          "Value filter '" + expression + "' ignored: " + ex.getMessage());
      return samples;
    }
    return samples.stream().filter(s -> filter.test(s.value())).toList();
  }
}
