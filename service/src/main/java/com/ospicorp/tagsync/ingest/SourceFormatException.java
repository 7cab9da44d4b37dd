package com.ospicorp.tagsync.ingest;

/** The source file cannot be read or does not have the structure its layout requires. */
public class SourceFormatException extends RuntimeException {

  public SourceFormatException(String message) {
    super(message);
  }

  public SourceFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
