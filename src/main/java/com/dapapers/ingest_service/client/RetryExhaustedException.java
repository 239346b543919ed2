package com.dapapers.ingest_service.client;

import lombok.Getter;

/** Raised once a {@link RetryPolicy} has used all its attempts. The cause is the last failure. */
@Getter
public class RetryExhaustedException extends ApiFetchException {

  private final int attempts;

  public RetryExhaustedException(String operation, int attempts, ApiFetchException lastFailure) {
    super(
        String.format(
            "%s failed after %d attempts: %s",
            operation, attempts, lastFailure == null ? "unknown" : lastFailure.getMessage()),
        lastFailure == null ? 0 : lastFailure.getStatusCode(),
        lastFailure);
    this.attempts = attempts;
  }
}
