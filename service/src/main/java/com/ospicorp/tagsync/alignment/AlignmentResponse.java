package com.ospicorp.tagsync.alignment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tagsync.series.model.Table;
import com.ospicorp.tagsync.series.report.Diagnostic;
import com.ospicorp.tagsync.series.service.ResamplePeriods;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public record AlignmentResponse(
    String period,
    LocalDateTime start,
    LocalDateTime end,
    @JsonProperty("row_count") int rowCount,
    List<String> columns,
    List<List<Object>> rows,
    List<SeriesSummary> series,
    List<Diagnostic> diagnostics) {

  public static AlignmentResponse from(AlignmentResult result) {
    Table table = result.table();
    List<String> columns = new ArrayList<>(table.columnCount() + 1);
    columns.add(table.timestampLabel());
    columns.addAll(table.columns());

    List<List<Object>> rows = new ArrayList<>(table.rowCount());
    for (int r = 0; r < table.rowCount(); r++) {
      List<Object> row = new ArrayList<>(columns.size());
      row.add(table.index().get(r));
      for (double value : table.row(r)) {
        row.add(value);
      }
      rows.add(row);
    }
    List<LocalDateTime> index = table.index();
    return new AlignmentResponse(ResamplePeriods.format(result.period()),
        index.get(0), index.get(index.size() - 1), table.rowCount(), columns, rows,
        result.series(), result.diagnostics());
  }
}
