package com.ospicorp.tagsync.ingest;

import java.util.List;

/** A delimited source file as read: the header row and the data rows, cells trimmed. */
public record SourceTable(List<String> header, List<List<String>> rows) {

  public SourceTable {
    header = List.copyOf(header);
    rows = List.copyOf(rows);
  }

  /** Cell text, or an empty string for a short row. */
  public String cell(int row, int column) {
    List<String> cells = rows.get(row);
    if (column >= cells.size()) {
      return "";
    }
    String value = cells.get(column);
    return value != null ? value : "";
  }

  public int rowCount() {
    return rows.size();
  }
}
