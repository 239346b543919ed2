package com.dapapers.ingest_service.driver;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.Getter;

/** Counters of one import run, updated by the driver loop and returned at the end. */
@Getter
public class ImportProgress {

  private final String sourceName;
  private final Stopwatch stopwatch;
  private long pages;
  private long converted;
  private long indexed;
  private long errors;
  private long skipped;
  private long total;
  private String resumeCursor;
  private ImportState state = ImportState.RUNNING;
  private String message = "";

  public ImportProgress(String sourceName, String startCursor) {
    this(sourceName, startCursor, Ticker.systemTicker());
  }

  ImportProgress(String sourceName, String startCursor, Ticker ticker) {
    this.sourceName = sourceName;
    this.resumeCursor = startCursor;
    this.stopwatch = Stopwatch.createStarted(ticker);
  }

  void pageFetched(long reportedTotal) {
    if (reportedTotal > 0) {
      total = reportedTotal;
    }
  }

  void pageDone(long convertedOnPage, long skippedOnPage, long indexedOnPage, long errorsOnPage) {
    pages++;
    converted += convertedOnPage;
    skipped += skippedOnPage;
    indexed += indexedOnPage;
    errors += errorsOnPage;
  }

  void advanceTo(String cursor) {
    resumeCursor = cursor;
  }

  void complete() {
    state = ImportState.COMPLETED;
    stopwatch.stop();
  }

  void stop(String reason) {
    state = ImportState.STOPPED;
    message = reason;
    stopwatch.stop();
  }

  void abort(String reason) {
    state = ImportState.ABORTED;
    message = reason;
    stopwatch.stop();
  }

  public boolean isFinished() {
    return state == ImportState.COMPLETED;
  }

  /** Share of the upstream total already walked (converted plus skipped), 0 when unknown. */
  public double percent() {
    if (total <= 0) {
      return 0;
    }
    return Math.min(100.0, 100.0 * (converted + skipped) / total);
  }

  public double recordsPerSecond() {
    long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    return millis <= 0 ? 0 : indexed * 1000.0 / millis;
  }

  /** Estimated time left at the current rate; null when it cannot be estimated. */
  public Duration eta() {
    double rate = recordsPerSecond();
    long remaining = total - converted - skipped;
    if (rate <= 0 || total <= 0 || remaining <= 0) {
      return null;
    }
    return Duration.ofSeconds((long) (remaining / rate));
  }

  public Duration elapsed() {
    return stopwatch.elapsed();
  }

  @Override
  public String toString() {
    Duration eta = eta();
    return String.format(
        "%s: page %d, converted %d, indexed %d, errors %d, skipped %d, %.1f%% of %d,"
            + " %.0f rec/s, ETA %s",
        sourceName,
        pages,
        converted,
        indexed,
        errors,
        skipped,
        percent(),
        total,
        recordsPerSecond(),
        eta == null ? "n/a" : eta.toMinutes() + "m");
  }
}
