package com.ospicorp.tagsync.series.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class WindowBoundsTest {
  private static final LocalDate TODAY = LocalDate.of(2023, 6, 1);

  private final FlexibleDateTimeParser parser = new FlexibleDateTimeParser();

  @Test
  void dateOnlyBoundsCoverWholeDays() {
    ProcessingReport report = new ProcessingReport();
    WindowBounds window = WindowBounds.resolve("2023-03-07", "2023-03-08", parser, TODAY, report);

    assertThat(window.start()).isEqualTo(LocalDateTime.of(2023, 3, 7, 0, 0));
    assertThat(window.end()).isEqualTo(LocalDateTime.of(2023, 3, 8, 23, 59, 59, 999_000_000));
    assertThat(report.diagnostics()).isEmpty();
  }

  @Test
  void timeOnlyBoundMeansToday() {
    WindowBounds window = WindowBounds.resolve("08:00", null, parser, TODAY,
        new ProcessingReport());

    assertThat(window.start()).isEqualTo(TODAY.atTime(8, 0));
    assertThat(window.end()).isNull();
  }

  @Test
  void unparsableBoundIsIgnoredAndReported() {
    ProcessingReport report = new ProcessingReport();
    WindowBounds window = WindowBounds.resolve("soon", "2023-03-08 12:00", parser, TODAY, report);

    assertThat(window.start()).isNull();
    assertThat(window.end()).isEqualTo(LocalDateTime.of(2023, 3, 8, 12, 0));
    assertThat(report.ofKind(DiagnosticKind.WINDOW_BOUND_IGNORED)).hasSize(1);
  }

  @Test
  void containsIsInclusive() {
    LocalDateTime start = LocalDateTime.of(2023, 1, 1, 0, 0);
    WindowBounds window = new WindowBounds(start, start.plusSeconds(10));

    assertThat(window.contains(start)).isTrue();
    assertThat(window.contains(start.plusSeconds(10))).isTrue();
    assertThat(window.contains(start.plusSeconds(11))).isFalse();
    assertThat(WindowBounds.unbounded().contains(start)).isTrue();
  }
}
