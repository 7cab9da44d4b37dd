package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.export.TableCsvWriter;
import com.ospicorp.tagsync.ingest.SourceLayout;
import com.ospicorp.tagsync.ingest.SourceTable;
import com.ospicorp.tagsync.ingest.SourceTableReader;
import com.ospicorp.tagsync.series.service.EmptyDatasetException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Aligns one export file from disk when {@code tagsync.batch.input} is set, writing the result
 * next to it as {@code <input>_ForExport.csv} unless {@code tagsync.batch.output} says otherwise.
 */
@Component
@ConditionalOnProperty(name = "tagsync.batch.input")
public class BatchAlignmentRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(BatchAlignmentRunner.class);

  private final AlignmentService service;
  private final SourceTableReader reader;
  private final TableCsvWriter writer;
  private final Path input;
  private final Path output;
  private final AlignmentRequest request;
  private final Charset sourceEncoding;
  private final char sourceDelimiter;

  public BatchAlignmentRunner(AlignmentService service, SourceTableReader reader,
      TableCsvWriter writer,
      @Value("${tagsync.batch.input}") String input,
      @Value("${tagsync.batch.output:}") String output,
      @Value("${tagsync.batch.layout:trend}") String layout,
      @Value("${tagsync.batch.resample:}") String resample,
      @Value("${tagsync.batch.stats:}") String stats,
      @Value("${tagsync.batch.value-filter:}") String valueFilter,
      @Value("${tagsync.batch.start:}") String start,
      @Value("${tagsync.batch.end:}") String end,
      @Value("${tagsync.batch.time-format:}") String timeFormat,
      @Value("${tagsync.source.encoding:UTF-8}") String sourceEncoding,
      @Value("${tagsync.source.delimiter:,}") String sourceDelimiter) {
    this.service = service;
    this.reader = reader;
    this.writer = writer;
    this.input = Path.of(input);
    this.output = StringUtils.hasText(output) ? Path.of(output) : defaultOutput(this.input);
    this.request = new AlignmentRequest(SourceLayout.fromCode(layout), resample, stats,
        valueFilter, start, end, timeFormat);
    this.sourceEncoding = Charset.forName(sourceEncoding);
    if (sourceDelimiter.length() != 1) {
      throw new IllegalArgumentException(
          "tagsync.source.delimiter must be a single character, was '" + sourceDelimiter + "'");
    }
    this.sourceDelimiter = sourceDelimiter.charAt(0);
  }

  static Path defaultOutput(Path input) {
    String name = StringUtils.stripFilenameExtension(input.getFileName().toString());
    return input.resolveSibling(name + AlignmentController.EXPORT_SUFFIX);
  }

  Path output() {
    return output;
  }

  @Override
  public void run(String... args) throws IOException {
    long started = System.currentTimeMillis();
    log.info("Batch alignment of {} ({}) started", input, request.layout());
    SourceTable source;
    try (InputStream in = Files.newInputStream(input)) {
      source = reader.read(in, sourceEncoding, sourceDelimiter);
    }
    AlignmentResult result;
    try {
      result = service.align(source, request);
    } catch (EmptyDatasetException ex) {
      log.error("Batch alignment of {} produced no data: {}", input, ex.getMessage());
      throw ex;
    }
    try (OutputStream out = Files.newOutputStream(output)) {
      writer.write(result.table(), out);
    }
    log.info("Batch alignment wrote {} rows x {} columns to {} in {} ms",
        result.table().rowCount(), result.table().columnCount(), output,
        System.currentTimeMillis() - started);
  }
}
