package com.ospicorp.tagsync.series.service;

public class FilterSyntaxException extends IllegalArgumentException {
  private final int position;

  public FilterSyntaxException(String message, int position) {
    super(message + " (at position " + position + ")");
    this.position = position;
  }

  public int position() {
    return position;
  }
}
