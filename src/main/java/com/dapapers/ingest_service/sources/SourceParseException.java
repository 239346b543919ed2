package com.dapapers.ingest_service.sources;

/** Upstream payload that could not be decoded into the expected structure. */
public class SourceParseException extends RuntimeException {

  public SourceParseException(String message) {
    super(message);
  }

  public SourceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
