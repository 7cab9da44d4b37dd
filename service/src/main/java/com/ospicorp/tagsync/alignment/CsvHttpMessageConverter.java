package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.export.TableCsvWriter;
import com.ospicorp.tagsync.series.model.Table;
import java.io.IOException;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Renders an aligned {@link Table} as {@code text/csv} through the export writer. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Table> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final TableCsvWriter writer;

  public CsvHttpMessageConverter(TableCsvWriter writer) {
    super(writer.charset(), TEXT_CSV);
    this.writer = writer;
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Table.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Table readInternal(@NonNull Class<? extends Table> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Table table, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    writer.write(table, outputMessage.getBody());
  }
}
