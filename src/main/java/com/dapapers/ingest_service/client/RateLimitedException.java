package com.dapapers.ingest_service.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Upstream asked us to slow down: HTTP 429, or 503 with a {@code Retry-After} header. Retried
 * after the server's {@code Retry-After} when given, else with a backoff that grows with each
 * attempt.
 */
public class RateLimitedException extends ApiFetchException {

  private final Duration retryAfter;

  public RateLimitedException(String message) {
    this(message, 429, null);
  }

  public RateLimitedException(String message, int statusCode, Duration retryAfter) {
    super(message, statusCode);
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
