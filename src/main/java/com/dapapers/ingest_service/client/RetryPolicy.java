package com.dapapers.ingest_service.client;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry loop shared by every upstream call.
 *
 * <p>A {@link RateLimitedException} waits the server's {@code Retry-After}, or {@code
 * rateLimitBackoff * attempt} without one; any other retryable
 * {@link ApiFetchException} waits the fixed {@code errorBackoff}. Non-retryable failures (4xx other
 * than 429) are rethrown at once. When all attempts fail a {@link RetryExhaustedException} carrying
 * the last failure is thrown.
 */
@Slf4j
@Getter
@Builder
public class RetryPolicy {

  private final String name;
  @Builder.Default private final int maxAttempts = 5;
  @Builder.Default private final Duration rateLimitBackoff = Duration.ofSeconds(5);
  @Builder.Default private final Duration errorBackoff = Duration.ofSeconds(2);
  @Builder.Default private final Sleeper sleeper = Sleeper.system();

  public <T> T execute(String operation, ApiCall<T> call) throws ApiFetchException {
    ApiFetchException lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return call.call();
      } catch (RateLimitedException e) {
        lastFailure = e;
        if (attempt < maxAttempts) {
          Duration wait = e.getRetryAfter().orElse(rateLimitBackoff.multipliedBy(attempt));
          log.warn("[{}] {} rate limited, waiting {} ms", name, operation, wait.toMillis());
          pause(wait, operation);
        }
      } catch (ApiFetchException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        lastFailure = e;
        if (attempt < maxAttempts) {
          log.warn(
              "[{}] {} failed (attempt {}/{}), retrying in {} ms - {}",
              name,
              operation,
              attempt,
              maxAttempts,
              errorBackoff.toMillis(),
              e.getMessage());
          pause(errorBackoff, operation);
        }
      }
    }
    throw new RetryExhaustedException(operation, maxAttempts, lastFailure);
  }

  private void pause(Duration wait, String operation) throws ApiFetchException {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ApiFetchException("Interrupted while waiting to retry " + operation, ie);
    }
  }
}
