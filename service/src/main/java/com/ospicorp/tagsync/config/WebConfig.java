package com.ospicorp.tagsync.config;

import com.ospicorp.tagsync.alignment.CsvHttpMessageConverter;
import com.ospicorp.tagsync.export.TableCsvWriter;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final TableCsvWriter tableCsvWriter;

  public WebConfig(TableCsvWriter tableCsvWriter) {
    this.tableCsvWriter = tableCsvWriter;
  }

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter(tableCsvWriter));
  }
}
