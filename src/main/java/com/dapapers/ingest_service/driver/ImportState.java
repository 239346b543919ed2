package com.dapapers.ingest_service.driver;

public enum ImportState {
  RUNNING,
  COMPLETED,
  /** Stopped on request between two pages. */
  STOPPED,
  /** Gave up after exhausting retries; resume from the recorded cursor. */
  ABORTED
}
