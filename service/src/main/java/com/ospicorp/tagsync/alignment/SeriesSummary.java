package com.ospicorp.tagsync.alignment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.List;

public record SeriesSummary(
    String name,
    int samples,
    @JsonProperty("native_period") String nativePeriod,
    @JsonProperty("first_timestamp") LocalDateTime firstTimestamp,
    @JsonProperty("last_timestamp") LocalDateTime lastTimestamp,
    List<String> columns) {
}
