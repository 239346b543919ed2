package com.dapapers.ingest_service.driver;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ImportProgressTest {

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker =
      new Ticker() {
        @Override
        public long read() {
          return nanos.get();
        }
      };

  @Test
  void rateAndEta_fromElapsedTime() {
    ImportProgress progress = new ImportProgress("test", "*", ticker);
    progress.pageFetched(1000);
    progress.pageDone(200, 0, 200, 0);
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));

    assertEquals(20.0, progress.percent());
    assertEquals(20.0, progress.recordsPerSecond());
    assertEquals(Duration.ofSeconds(40), progress.eta());
    assertEquals(Duration.ofSeconds(10), progress.elapsed());
  }

  @Test
  void eta_unknownTotal_null() {
    ImportProgress progress = new ImportProgress("test", "*", ticker);
    progress.pageDone(10, 0, 10, 0);
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(1));

    assertNull(progress.eta());
    assertEquals(0.0, progress.percent());
  }

  @Test
  void pageFetched_zeroTotal_keepsLastKnownTotal() {
    ImportProgress progress = new ImportProgress("test", "*", ticker);
    progress.pageFetched(500);
    progress.pageFetched(0);

    assertEquals(500, progress.getTotal());
  }

  @Test
  void stateTransitions_stopwatchStops() {
    ImportProgress progress = new ImportProgress("test", "*", ticker);
    progress.advanceTo("c5");
    progress.abort("HTTP 500");
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(30));

    assertEquals(ImportState.ABORTED, progress.getState());
    assertEquals("c5", progress.getResumeCursor());
    assertEquals(Duration.ZERO, progress.elapsed());
    assertFalse(progress.isFinished());
  }
}
