package com.ospicorp.tagsync.series.model;

// One unparsed row for a single instrument, as handed over by the source file reader
public record RawRecord(String name, String rawTimestamp, String rawValue) {}
