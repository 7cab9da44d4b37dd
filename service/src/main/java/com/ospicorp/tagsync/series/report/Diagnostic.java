package com.ospicorp.tagsync.series.report;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(DiagnosticKind kind, String series, String message, boolean warning) {}
