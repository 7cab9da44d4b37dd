package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.series.model.Table;
import com.ospicorp.tagsync.series.report.Diagnostic;
import java.time.Duration;
import java.util.List;

public record AlignmentResult(Table table, Duration period, List<SeriesSummary> series,
    List<Diagnostic> diagnostics) {
}
