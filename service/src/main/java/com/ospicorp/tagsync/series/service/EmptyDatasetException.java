package com.ospicorp.tagsync.series.service;

/** Raised when there is nothing to align: no usable samples, or an empty merge window. */
public class EmptyDatasetException extends RuntimeException {

  public EmptyDatasetException(String message) {
    super(message);
  }
}
