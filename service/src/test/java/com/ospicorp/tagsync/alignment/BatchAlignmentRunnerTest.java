package com.ospicorp.tagsync.alignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tagsync.export.TableCsvWriter;
import com.ospicorp.tagsync.ingest.SourceTableReader;
import com.ospicorp.tagsync.series.service.EmptyDatasetException;
import com.ospicorp.tagsync.series.service.FlexibleDateTimeParser;
import com.ospicorp.tagsync.series.service.SeriesBuilder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchAlignmentRunnerTest {
  private static final String TREND_CSV = "A Time,A ValueY\n"
      + "1/1/2023 12:00:00 AM,1\n"
      + "1/1/2023 12:00:01 AM,2\n";

  @TempDir
  Path dir;

  private static BatchAlignmentRunner runner(Path input, String filter) {
    AlignmentService service = new AlignmentService(new FlexibleDateTimeParser(),
        Clock.systemDefaultZone(), SeriesBuilder.DEFAULT_TIME_FORMAT, 1_000_000L, 1_000_000L,
        false);
    TableCsvWriter writer = new TableCsvWriter(List.of("EXPORT CONTROLLED"), ',',
        StandardCharsets.UTF_8);
    return new BatchAlignmentRunner(service, new SourceTableReader(), writer, input.toString(),
        "", "trend", "", "", filter, "", "", "", "UTF-8", ",");
  }

  @Test
  void defaultOutputSitsNextToInput() {
    assertThat(BatchAlignmentRunner.defaultOutput(Path.of("/data/trend.csv")))
        .isEqualTo(Path.of("/data/trend_ForExport.csv"));
  }

  @Test
  void writesExportFile() throws Exception {
    Path input = dir.resolve("trend.csv");
    Files.writeString(input, TREND_CSV, StandardCharsets.UTF_8);

    BatchAlignmentRunner runner = runner(input, "");
    runner.run();

    assertThat(runner.output()).isEqualTo(dir.resolve("trend_ForExport.csv"));
    assertThat(Files.readAllLines(runner.output(), StandardCharsets.UTF_8)).containsExactly(
        "EXPORT CONTROLLED",
        "timestamp,value_A",
        "2023-01-01 00:00:00,1.0",
        "2023-01-01 00:00:01,2.0");
  }

  @Test
  void emptyResultFailsTheRun() throws Exception {
    Path input = dir.resolve("trend.csv");
    Files.writeString(input, TREND_CSV, StandardCharsets.UTF_8);

    assertThatThrownBy(() -> runner(input, "val < 0").run())
        .isInstanceOf(EmptyDatasetException.class);
    assertThat(dir.resolve("trend_ForExport.csv")).doesNotExist();
  }
}
