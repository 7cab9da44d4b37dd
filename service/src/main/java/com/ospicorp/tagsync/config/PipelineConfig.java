package com.ospicorp.tagsync.config;

import com.ospicorp.tagsync.export.TableCsvWriter;
import com.ospicorp.tagsync.ingest.SourceTableReader;
import com.ospicorp.tagsync.series.service.FlexibleDateTimeParser;
import java.nio.charset.Charset;
import java.time.Clock;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class PipelineConfig {

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  FlexibleDateTimeParser flexibleDateTimeParser() {
    return new FlexibleDateTimeParser();
  }

  @Bean
  SourceTableReader sourceTableReader() {
    return new SourceTableReader();
  }

  // The banner is free text; each line of it becomes one line above the header.
  @Bean
  TableCsvWriter tableCsvWriter(
      @Value("${tagsync.export.banner:}") String banner,
      @Value("${tagsync.export.delimiter:,}") String delimiter,
      @Value("${tagsync.export.encoding:UTF-8}") String encoding) {
    if (delimiter.length() != 1) {
      throw new IllegalArgumentException(
          "tagsync.export.delimiter must be a single character, was '" + delimiter + "'");
    }
    List<String> lines = StringUtils.hasText(banner)
        ? banner.strip().lines().map(String::strip).toList()
        : List.of();
    return new TableCsvWriter(lines, delimiter.charAt(0), Charset.forName(encoding));
  }
}
