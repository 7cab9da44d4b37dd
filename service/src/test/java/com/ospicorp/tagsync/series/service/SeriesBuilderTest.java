package com.ospicorp.tagsync.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tagsync.series.model.RawRecord;
import com.ospicorp.tagsync.series.model.Sample;
import com.ospicorp.tagsync.series.model.TimeSeries;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesBuilderTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2023, 1, 1, 0, 0);

  private final FlexibleDateTimeParser parser = new FlexibleDateTimeParser();
  private final SeriesBuilder builder = new SeriesBuilder(null, parser);

  private static RawRecord row(String timestamp, String value) {
    return new RawRecord("A", timestamp, value);
  }

  @Test
  void sortsAndKeepsLastDuplicate() {
    TimeSeries series = builder.build(SeriesDefinition.of("A", List.of(
        row("1/1/2023 12:00:02 AM", "2"),
        row("1/1/2023 12:00:00 AM", "0"),
        row("1/1/2023 12:00:02 AM", "5"))), new ProcessingReport());

    assertThat(series.samples()).containsExactly(
        new Sample(T0, 0.0),
        new Sample(T0.plusSeconds(2), 5.0));
    assertThat(series.period()).isNull();
  }

  @Test
  void dropsBadRowsWithOneSummary() {
    ProcessingReport report = new ProcessingReport();
    TimeSeries series = builder.build(SeriesDefinition.of("A", List.of(
        row("not a time", "1"),
        row("1/1/2023 12:00:01 AM", "abc"),
        row("1/1/2023 12:00:02 AM", "NaN"),
        row("1/1/2023 12:00:03 AM", " 4.5 "))), report);

    assertThat(series.size()).isEqualTo(1);
    assertThat(series.samples().get(0).value()).isEqualTo(4.5);
    assertThat(report.ofKind(DiagnosticKind.ROW_DROPPED)).singleElement()
        .satisfies(d -> assertThat(d.message()).contains("Dropped 3 of 4").contains("row 1"));
  }

  @Test
  void fallsBackToLenientParsing() {
    TimeSeries series = builder.build(SeriesDefinition.of("A", List.of(
        row("2023-01-01T00:00:05", "1"))), new ProcessingReport());

    assertThat(series.first()).isEqualTo(T0.plusSeconds(5));
  }

  @Test
  void roundsToMillisecondsBeforeDeduplicating() {
    SeriesBuilder archive = new SeriesBuilder("%Y-%m-%d %H:%M:%S.%f", parser);
    TimeSeries series = archive.build(SeriesDefinition.of("A", List.of(
        row("2023-01-01 00:00:00.0004", "1"),
        row("2023-01-01 00:00:00.0001", "2"),
        row("2023-01-01 00:00:00.0015", "3"))), new ProcessingReport());

    assertThat(series.samples()).containsExactly(
        new Sample(T0, 2.0),
        new Sample(T0.plusNanos(2_000_000), 3.0));
  }

  @Test
  void appliesValueFilter() {
    TimeSeries series = builder.build(new SeriesDefinition("A", null, null, List.of(
        row("1/1/2023 12:00:00 AM", "100.0"),
        row("1/1/2023 12:00:01 AM", "100.001"),
        row("1/1/2023 12:00:02 AM", "-1"),
        row("1/1/2023 12:00:03 AM", "50")), "val >= 0 and val <= 100", null),
        new ProcessingReport());

    assertThat(series.samples()).extracting(Sample::value).containsExactly(100.0, 50.0);
  }

  @Test
  void malformedFilterIsSkipped() {
    ProcessingReport report = new ProcessingReport();
    TimeSeries series = builder.build(new SeriesDefinition("A", null, null, List.of(
        row("1/1/2023 12:00:00 AM", "1"),
        row("1/1/2023 12:00:01 AM", "2")), "val >> 3", null), report);

    assertThat(series.size()).isEqualTo(2);
    assertThat(report.has(DiagnosticKind.FILTER_SKIPPED)).isTrue();
  }

  @Test
  void clipsToWindowInclusive() {
    WindowBounds window = new WindowBounds(T0.plusSeconds(1), T0.plusSeconds(2));
    TimeSeries series = builder.build(new SeriesDefinition("A", "timestamp_A", "value_A",
        List.of(
            row("1/1/2023 12:00:00 AM", "1"),
            row("1/1/2023 12:00:01 AM", "2"),
            row("1/1/2023 12:00:02 AM", "3"),
            row("1/1/2023 12:00:03 AM", "4")), null, window), new ProcessingReport());

    assertThat(series.index()).containsExactly(T0.plusSeconds(1), T0.plusSeconds(2));
    assertThat(series.valueLabel()).isEqualTo("value_A");
    assertThat(series.windowStart()).isEqualTo(T0.plusSeconds(1));
    assertThat(series.windowEnd()).isEqualTo(T0.plusSeconds(2));
  }

  @Test
  void rejectsUnusableFormatHint() {
    assertThatThrownBy(() -> new SeriesBuilder("%H:%M", parser))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
