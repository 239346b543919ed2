package com.dapapers.ingest_service.client;

import java.time.Duration;

/** Waits between calls. Tests swap in a recording implementation so nothing actually sleeps. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> {
      if (!duration.isZero() && !duration.isNegative()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
