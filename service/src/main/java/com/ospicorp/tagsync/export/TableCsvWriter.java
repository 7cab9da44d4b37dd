package com.ospicorp.tagsync.export;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.tagsync.series.model.Table;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes an aligned {@link Table} as delimited text: optional banner lines, a header row
 * starting with the timestamp label, then one row per grid timestamp.
 */
public class TableCsvWriter {
  private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern(
      "yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter MILLIS = DateTimeFormatter.ofPattern(
      "yyyy-MM-dd HH:mm:ss.SSS");

  private final List<String> banner;
  private final Charset charset;
  private final ObjectWriter rowWriter;

  public TableCsvWriter(List<String> banner, char delimiter, Charset charset) {
    this.banner = List.copyOf(banner);
    this.charset = charset;
    CsvMapper mapper = CsvMapper.builder()
        .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
        .build();
    this.rowWriter = mapper.writerFor(String[].class)
        .with(CsvSchema.emptySchema().withColumnSeparator(delimiter).withLineSeparator("\n"))
        // only quote cells that contain the delimiter, a quote or a line break
        .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
  }

  public Charset charset() {
    return charset;
  }

  /** Writes to {@code out} and flushes; the stream is left open. */
  public void write(Table table, OutputStream out) throws IOException {
    Writer writer = new OutputStreamWriter(out, charset);
    write(table, writer);
    writer.flush();
  }

  public void write(Table table, Writer writer) throws IOException {
    for (String line : banner) {
      writer.write(line);
      writer.write('\n');
    }
    DateTimeFormatter timestamps = hasMillis(table.index()) ? MILLIS : SECONDS;
    try (SequenceWriter rows = rowWriter.writeValues(writer)) {
      List<String> columns = table.columns();
      String[] cells = new String[columns.size() + 1];
      cells[0] = table.timestampLabel();
      for (int c = 0; c < columns.size(); c++) {
        cells[c + 1] = columns.get(c);
      }
      rows.write(cells);
      for (int r = 0; r < table.rowCount(); r++) {
        cells = new String[columns.size() + 1];
        cells[0] = timestamps.format(table.index().get(r));
        for (int c = 0; c < columns.size(); c++) {
          cells[c + 1] = formatValue(table.get(r, c));
        }
        rows.write(cells);
      }
    }
    writer.flush();
  }

  public String writeToString(Table table) throws IOException {
    StringWriter writer = new StringWriter();
    write(table, writer);
    return writer.toString();
  }

  static String formatValue(double value) {
    double magnitude = Math.abs(value);
    if (value == 0.0 || (magnitude >= 1e-3 && magnitude < 1e7)
        || Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value == 0.0 ? 0.0 : value);
    }
    return BigDecimal.valueOf(value).toPlainString();
  }

  private static boolean hasMillis(List<LocalDateTime> index) {
    for (LocalDateTime timestamp : index) {
      if (timestamp.getNano() != 0) {
        return true;
      }
    }
    return false;
  }
}
