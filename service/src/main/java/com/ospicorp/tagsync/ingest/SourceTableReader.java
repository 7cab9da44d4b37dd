package com.ospicorp.tagsync.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a delimited source file with a header row into a {@link SourceTable}. Cells are trimmed
 * and empty lines skipped.
 */
public class SourceTableReader {
  private static final Logger log = LoggerFactory.getLogger(SourceTableReader.class);
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final CsvMapper mapper = new CsvMapper();

  public SourceTable read(InputStream in, Charset charset, char delimiter) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
    ObjectReader reader = mapper.readerFor(String[].class)
        .with(schema)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.TRIM_SPACES)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    List<String[]> lines;
    try (BufferedReader source = new BufferedReader(new InputStreamReader(in, charset));
        MappingIterator<String[]> iterator = reader.readValues(source)) {
      lines = iterator.readAll();
    } catch (JsonProcessingException ex) {
      throw new SourceFormatException("Source file is not valid delimited text: "
          + ex.getOriginalMessage(), ex);
    }
    if (lines.isEmpty()) {
      throw new SourceFormatException("Source file has no header row");
    }

    List<String> header = new ArrayList<>(Arrays.asList(lines.get(0)));
    if (!header.isEmpty() && header.get(0).indexOf(BYTE_ORDER_MARK) == 0) {
      header.set(0, header.get(0).substring(1).trim());
    }
    List<List<String>> rows = new ArrayList<>(lines.size() - 1);
    for (int i = 1; i < lines.size(); i++) {
      rows.add(Arrays.asList(lines.get(i)));
    }
    log.debug("Read source with {} columns and {} rows ({}, delimiter '{}')", header.size(),
        rows.size(), charset, delimiter);
    return new SourceTable(header, rows);
  }
}
