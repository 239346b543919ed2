package com.dapapers.ingest_service.client;

import lombok.Getter;

/**
 * Failure of a single upstream API call.
 *
 * <p>{@code statusCode} is the HTTP status when the server answered, or {@code 0} for transport
 * and decoding failures. Transport failures, 5xx and 429 answers are retryable; other 4xx answers
 * are not.
 */
@Getter
public class ApiFetchException extends Exception {

  private final int statusCode;

  public ApiFetchException(String message) {
    this(message, 0, null);
  }

  public ApiFetchException(String message, Throwable cause) {
    this(message, 0, cause);
  }

  public ApiFetchException(String message, int statusCode) {
    this(message, statusCode, null);
  }

  public ApiFetchException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public boolean isRetryable() {
    return statusCode == 0 || statusCode == 429 || statusCode >= 500;
  }
}
