package com.ospicorp.tagsync.series.service;

import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Inclusive time window; either end may be open ({@code null}).
 */
public record WindowBounds(LocalDateTime start, LocalDateTime end) {

  private static final WindowBounds UNBOUNDED = new WindowBounds(null, null);

  public static WindowBounds unbounded() {
    return UNBOUNDED;
  }

  /**
   * Resolves user supplied bound text. A start without a time of day means midnight, an end
   * without one means the last millisecond of that day, and a bare time means that time
   * {@code today}. Text that cannot be parsed leaves that end open and is reported.
   */
  public static WindowBounds resolve(String startText, String endText,
      FlexibleDateTimeParser parser, LocalDate today, ProcessingReport report) {
    LocalDateTime start = parseBound("start", startText, parser, report)
        .map(parsed -> parsed.asStart(today))
        .orElse(null);
    LocalDateTime end = parseBound("end", endText, parser, report)
        .map(parsed -> parsed.asEnd(today))
        .orElse(null);
    return new WindowBounds(start, end);
  }

  private static Optional<FlexibleDateTimeParser.ParsedDateTime> parseBound(String which,
      String text, FlexibleDateTimeParser parser, ProcessingReport report) {
    if (!StringUtils.hasText(text)) {
      return Optional.empty();
    }
    Optional<FlexibleDateTimeParser.ParsedDateTime> parsed = parser.parse(text);
    if (parsed.isEmpty()) {
      report.warn(DiagnosticKind.WINDOW_BOUND_IGNORED, null,
          "Could not parse " + which + " time '" + text + "'; " + which + " bound ignored");
    }
    return parsed;
  }

  public boolean isUnbounded() {
    return start == null && end == null;
  }

  public boolean contains(LocalDateTime timestamp) {
    return (start == null || !timestamp.isBefore(start))
        && (end == null || !timestamp.isAfter(end));
  }
}
