package com.dapapers.ingest_service.client;

import static org.junit.jupiter.api.Assertions.*;

import com.dapapers.ingest_service.TestFixtures.RecordingSleeper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private RecordingSleeper sleeper;
  private RetryPolicy policy;

  @BeforeEach
  void setUp() {
    sleeper = new RecordingSleeper();
    policy =
        RetryPolicy.builder()
            .name("test")
            .maxAttempts(3)
            .rateLimitBackoff(Duration.ofSeconds(5))
            .errorBackoff(Duration.ofSeconds(2))
            .sleeper(sleeper)
            .build();
  }

  @Test
  void execute_firstAttemptSucceeds_noWait() throws ApiFetchException {
    assertEquals("ok", policy.execute("op", () -> "ok"));
    assertTrue(sleeper.getWaits().isEmpty());
  }

  @Test
  void execute_rateLimitedTwice_waitsGrowWithAttempt() throws ApiFetchException {
    AtomicInteger calls = new AtomicInteger();
    String result =
        policy.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new RateLimitedException("429");
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10)), sleeper.getWaits());
  }

  @Test
  void execute_rateLimitedWithRetryAfter_waitsServerDelay() throws ApiFetchException {
    AtomicInteger calls = new AtomicInteger();
    String result =
        policy.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new RateLimitedException("503", 503, Duration.ofSeconds(7));
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(List.of(Duration.ofSeconds(7)), sleeper.getWaits());
  }

  @Test
  void execute_serverErrorThenSuccess_waitsFixedBackoff() throws ApiFetchException {
    AtomicInteger calls = new AtomicInteger();
    String result =
        policy.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new ApiFetchException("boom", 503);
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(List.of(Duration.ofSeconds(2)), sleeper.getWaits());
  }

  @Test
  void execute_allAttemptsFail_throwsExhaustedWithLastFailure() {
    AtomicInteger calls = new AtomicInteger();
    RetryExhaustedException ex =
        assertThrows(
            RetryExhaustedException.class,
            () ->
                policy.execute(
                    "fetch page",
                    () -> {
                      throw new ApiFetchException("attempt " + calls.incrementAndGet(), 500);
                    }));

    assertEquals(3, calls.get());
    assertEquals(3, ex.getAttempts());
    assertEquals(500, ex.getStatusCode());
    assertEquals("attempt 3", ex.getCause().getMessage());
    assertEquals(2, sleeper.getWaits().size(), "no wait after the last attempt");
  }

  @Test
  void execute_clientError_rethrownWithoutRetry() {
    AtomicInteger calls = new AtomicInteger();
    ApiFetchException ex =
        assertThrows(
            ApiFetchException.class,
            () ->
                policy.execute(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new ApiFetchException("not found", 404);
                    }));

    assertFalse(ex instanceof RetryExhaustedException);
    assertEquals(1, calls.get());
    assertTrue(sleeper.getWaits().isEmpty());
  }

  @Test
  void execute_interruptedWhileWaiting_throwsAndKeepsInterruptFlag() {
    RetryPolicy interrupting =
        RetryPolicy.builder()
            .name("test")
            .maxAttempts(3)
            .sleeper(
                d -> {
                  throw new InterruptedException();
                })
            .build();

    assertThrows(
        ApiFetchException.class,
        () ->
            interrupting.execute(
                "op",
                () -> {
                  throw new ApiFetchException("io", 0);
                }));
    assertTrue(Thread.interrupted());
  }
}
