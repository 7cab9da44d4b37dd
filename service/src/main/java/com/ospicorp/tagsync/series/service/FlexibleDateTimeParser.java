package com.ospicorp.tagsync.series.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient parser for timestamps whose layout is not known up front: ISO-8601, year-first and
 * month-first dates, abbreviated month names, 12 and 24 hour clocks, optional seconds and
 * fractions. It also accepts a date or a time on its own and reports which parts were present.
 */
public class FlexibleDateTimeParser {

  public static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

  private enum Parts { DATE_TIME, DATE, TIME }

  private record Candidate(DateTimeFormatter formatter, Parts parts) {}

  /** What a lenient parse found. Either part may be missing, never both. */
  public record ParsedDateTime(LocalDate date, LocalTime time) {

    public boolean hasDate() {
      return date != null;
    }

    public boolean hasTime() {
      return time != null;
    }

    /** Missing date means {@code today}; missing time means midnight. */
    public LocalDateTime asStart(LocalDate today) {
      return (date != null ? date : today).atTime(time != null ? time : LocalTime.MIDNIGHT);
    }

    /** Missing date means {@code today}; missing time means the last millisecond of the day. */
    public LocalDateTime asEnd(LocalDate today) {
      return (date != null ? date : today).atTime(time != null ? time : END_OF_DAY);
    }
  }

  private final List<Candidate> candidates = List.of(
      new Candidate(DateTimeFormatter.ISO_LOCAL_DATE_TIME, Parts.DATE_TIME),
      new Candidate(dateTime("uuuu-M-d", false), Parts.DATE_TIME),
      new Candidate(dateTime("uuuu/M/d", false), Parts.DATE_TIME),
      new Candidate(dateTime("M/d/uuuu", true), Parts.DATE_TIME),
      new Candidate(dateTime("M/d/uuuu", false), Parts.DATE_TIME),
      new Candidate(dateTime("d-MMM-uuuu", true), Parts.DATE_TIME),
      new Candidate(dateTime("d-MMM-uuuu", false), Parts.DATE_TIME),
      new Candidate(dateTime("MMM d[,] uuuu", true), Parts.DATE_TIME),
      new Candidate(dateTime("MMM d[,] uuuu", false), Parts.DATE_TIME),
      new Candidate(pattern("uuuu-M-d"), Parts.DATE),
      new Candidate(pattern("uuuu/M/d"), Parts.DATE),
      new Candidate(pattern("M/d/uuuu"), Parts.DATE),
      new Candidate(pattern("d-MMM-uuuu"), Parts.DATE),
      new Candidate(pattern("MMM d[,] uuuu"), Parts.DATE),
      new Candidate(pattern("uuuuMMdd"), Parts.DATE),
      new Candidate(time(true), Parts.TIME),
      new Candidate(time(false), Parts.TIME));

  public Optional<ParsedDateTime> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    for (Candidate candidate : candidates) {
      Optional<TemporalAccessor> parsed = tryParse(candidate.formatter(), trimmed);
      if (parsed.isEmpty()) {
        continue;
      }
      TemporalAccessor value = parsed.get();
      return Optional.of(switch (candidate.parts()) {
        case DATE_TIME -> new ParsedDateTime(LocalDate.from(value), LocalTime.from(value));
        case DATE -> new ParsedDateTime(LocalDate.from(value), null);
        case TIME -> new ParsedDateTime(null, LocalTime.from(value));
      });
    }
    return Optional.empty();
  }

  /** Full timestamp, or empty when the text has no date part or cannot be parsed. */
  public Optional<LocalDateTime> parseDateTime(String text) {
    return parse(text)
        .filter(ParsedDateTime::hasDate)
        .map(parsed -> parsed.asStart(parsed.date()));
  }

  private static Optional<TemporalAccessor> tryParse(DateTimeFormatter formatter, String text) {
    try {
      return Optional.of(formatter.parse(text));
    } catch (DateTimeParseException ex) {
      // not this layout; the caller moves on to the next candidate
      return Optional.empty();
    }
  }

  private static DateTimeFormatter pattern(String datePattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(datePattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatter dateTime(String datePattern, boolean twelveHour) {
    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(datePattern)
        .appendLiteral(' ');
    appendClock(builder, twelveHour);
    return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatter time(boolean twelveHour) {
    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
    appendClock(builder, twelveHour);
    return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
  }

  private static void appendClock(DateTimeFormatterBuilder builder, boolean twelveHour) {
    builder.appendPattern(twelveHour ? "h:mm" : "H:mm")
        .optionalStart()
        .appendPattern(":ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .optionalEnd();
    if (twelveHour) {
      builder.optionalStart().appendLiteral(' ').optionalEnd().appendPattern("a");
    }
  }
}
