package com.ospicorp.tagsync.series.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects what each stage recovered from. Every entry is logged as it is recorded; merging
 * reports does not log again. Not thread-safe: use one report per series when building in
 * parallel and merge them afterwards.
 */
public final class ProcessingReport {

  private static final Logger log = LoggerFactory.getLogger(ProcessingReport.class);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public void warn(DiagnosticKind kind, String series, String message) {
    log.warn("{} [{}]: {}", kind, series != null ? series : "run", message);
    diagnostics.add(new Diagnostic(kind, series, message, true));
  }

  public void info(DiagnosticKind kind, String series, String message) {
    log.info("{} [{}]: {}", kind, series != null ? series : "run", message);
    diagnostics.add(new Diagnostic(kind, series, message, false));
  }

  public void merge(ProcessingReport other) {
    diagnostics.addAll(other.diagnostics);
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  public List<Diagnostic> ofKind(DiagnosticKind kind) {
    return diagnostics.stream().filter(d -> d.kind() == kind).toList();
  }

  public boolean has(DiagnosticKind kind) {
    return diagnostics.stream().anyMatch(d -> d.kind() == kind);
  }

  public long warningCount() {
    return diagnostics.stream().filter(Diagnostic::warning).count();
  }
}
