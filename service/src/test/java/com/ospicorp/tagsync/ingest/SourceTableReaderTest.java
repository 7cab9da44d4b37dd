package com.ospicorp.tagsync.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceTableReaderTest {
  private final SourceTableReader reader = new SourceTableReader();

  private SourceTable read(String text, Charset charset, char delimiter) throws IOException {
    return reader.read(new ByteArrayInputStream(text.getBytes(charset)), charset, delimiter);
  }

  @Test
  void trimsCellsAndSkipsEmptyLines() throws IOException {
    SourceTable table = read("A Time, A ValueY\n1/1/2023 12:00:00 AM,  1.5\n\n1/1/2023 12:00:01 AM,2\n",
        StandardCharsets.UTF_8, ',');

    assertThat(table.header()).containsExactly("A Time", "A ValueY");
    assertThat(table.rows()).containsExactly(
        List.of("1/1/2023 12:00:00 AM", "1.5"),
        List.of("1/1/2023 12:00:01 AM", "2"));
  }

  @Test
  void readsUtf16Exports() throws IOException {
    SourceTable table = read("Tag Time,Tag ValueY\r\n1/1/2023 12:00:00 AM,3\r\n",
        StandardCharsets.UTF_16, ',');

    assertThat(table.header()).containsExactly("Tag Time", "Tag ValueY");
    assertThat(table.cell(0, 1)).isEqualTo("3");
  }

  @Test
  void stripsUtf8ByteOrderMark() throws IOException {
    SourceTable table = read("\uFEFFTime;FT 101\nt1;1\n", StandardCharsets.UTF_8, ';');

    assertThat(table.header()).containsExactly("Time", "FT 101");
    assertThat(table.cell(0, 5)).isEmpty();
  }

  @Test
  void emptyFileHasNoHeader() {
    assertThatThrownBy(() -> read("", StandardCharsets.UTF_8, ','))
        .isInstanceOf(SourceFormatException.class);
  }
}
