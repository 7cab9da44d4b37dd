package com.ospicorp.tagsync.alignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tagsync.ingest.SourceLayout;
import com.ospicorp.tagsync.ingest.SourceTable;
import com.ospicorp.tagsync.series.model.Table;
import com.ospicorp.tagsync.series.report.Diagnostic;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.service.EmptyDatasetException;
import com.ospicorp.tagsync.series.service.FlexibleDateTimeParser;
import com.ospicorp.tagsync.series.service.SeriesBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlignmentServiceTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2023, 1, 1, 0, 0);

  static final SourceTable TREND = new SourceTable(
      List.of("A Time", "A ValueY", "B Time", "B ValueY"),
      List.of(
          List.of("1/1/2023 12:00:00 AM", "1", "1/1/2023 12:00:01 AM", "10"),
          List.of("1/1/2023 12:00:01 AM", "2", "1/1/2023 12:00:03 AM", "30"),
          List.of("1/1/2023 12:00:02 AM", "3", "", ""),
          List.of("1/1/2023 12:00:03 AM", "4", "", "")));

  private static AlignmentService service(boolean parallel) {
    Clock clock = Clock.fixed(Instant.parse("2023-01-01T12:00:00Z"), ZoneOffset.UTC);
    return new AlignmentService(new FlexibleDateTimeParser(), clock,
        SeriesBuilder.DEFAULT_TIME_FORMAT, 10_000_000L, 10_000_000L, parallel);
  }

  private static AlignmentRequest request(String resample, String stats, String filter,
      String start, String end) {
    return new AlignmentRequest(SourceLayout.HISTORICAL_TREND, resample, stats, filter, start,
        end, null);
  }

  @Test
  void alignsOnOneSecondGridWithoutResampling() {
    AlignmentResult result = service(false).align(TREND, AlignmentRequest.of(
        SourceLayout.HISTORICAL_TREND));

    Table table = result.table();
    assertThat(result.period()).isEqualTo(Duration.ofSeconds(1));
    assertThat(table.index()).containsExactly(T0, T0.plusSeconds(1), T0.plusSeconds(2),
        T0.plusSeconds(3));
    assertThat(table.columns()).containsExactly("value_A", "value_B");
    assertThat(table.column("value_B")).containsExactly(0, 10, 10, 30);
    assertThat(result.series()).extracting(SeriesSummary::nativePeriod)
        .containsExactly("1S", "2S");
  }

  @Test
  void downsamplesAndSkipsSeriesAlreadyAtTarget() {
    AlignmentResult result = service(false).align(TREND, request("2S", "x", null, null, null));

    Table table = result.table();
    assertThat(table.index()).containsExactly(T0, T0.plusSeconds(2), T0.plusSeconds(4));
    assertThat(table.columns()).containsExactly("max_A", "value_B");
    assertThat(table.column("max_A")).containsExactly(1, 3, 4);
    assertThat(table.column("value_B")).containsExactly(0, 10, 30);
    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .contains(DiagnosticKind.RESAMPLE_SKIPPED);
  }

  @Test
  void invalidPeriodDefaultsToOneSecond() {
    AlignmentResult result = service(false).align(TREND,
        request("banana", null, null, null, null));

    assertThat(result.period()).isEqualTo(Duration.ofSeconds(1));
    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .contains(DiagnosticKind.PERIOD_DEFAULTED);
  }

  @Test
  void statsWithoutPeriodAreIgnored() {
    AlignmentResult result = service(false).align(TREND, request(null, "ix", null, null, null));

    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .contains(DiagnosticKind.STATS_IGNORED);
    assertThat(result.table().columns()).containsExactly("value_A", "value_B");
  }

  @Test
  void windowClipsTheGrid() {
    AlignmentResult result = service(false).align(TREND,
        request(null, null, null, "1/1/2023 12:00:02 AM", null));

    assertThat(result.table().index()).containsExactly(T0.plusSeconds(2), T0.plusSeconds(3));
    assertThat(result.table().column("value_A")).containsExactly(3, 4);
    assertThat(result.table().column("value_B")).containsExactly(0, 30);
  }

  @Test
  void filteringEverythingOutIsAnEmptyDataset() {
    assertThatThrownBy(() -> service(false).align(TREND,
        request(null, null, "val > 1000", null, null)))
        .isInstanceOf(EmptyDatasetException.class);
  }

  @Test
  void parallelBuildGivesTheSameTable() {
    Table sequential = service(false).align(TREND, request("2S", "im", null, null, null)).table();
    Table parallel = service(true).align(TREND, request("2S", "im", null, null, null)).table();

    assertThat(parallel.columns()).isEqualTo(sequential.columns());
    for (String column : sequential.columns()) {
      assertThat(parallel.column(column)).containsExactly(sequential.column(column));
    }
  }

  @Test
  void archiveLayoutUsesItsOwnTimestampFormat() {
    SourceTable archive = new SourceTable(
        List.of("ValueId", "Timestamp", "value", "quality", "flags"),
        List.of(
            List.of("FT-101", "2023-01-01 00:00:00.000", "1", "192", "0"),
            List.of("FT-101", "2023-01-01 00:00:01.000", "2", "192", "0")));

    AlignmentResult result = service(false).align(archive,
        AlignmentRequest.of(SourceLayout.ARCHIVE));

    assertThat(result.table().columns()).containsExactly("FT_101");
    assertThat(result.table().column("FT_101")).containsExactly(1, 2);
  }
}
