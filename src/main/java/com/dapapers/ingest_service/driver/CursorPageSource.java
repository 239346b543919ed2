package com.dapapers.ingest_service.driver;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.model.PaperRecord;
import java.time.Duration;
import java.util.Optional;

/** Upstream listing walked page by page by the {@link CursorImportDriver}. */
public interface CursorPageSource<T> {

  /** Short name used in logs. */
  String name();

  /** Fetches the page at {@code cursor}. A single attempt; the driver retries. */
  CursorPage<T> fetchPage(String cursor) throws ApiFetchException;

  /** Converts one item; empty when the item cannot become an indexable record. */
  Optional<PaperRecord> convert(T item);

  /** Least wait between two page requests the upstream asks for; the driver never waits less. */
  default Duration minPageInterval() {
    return Duration.ZERO;
  }
}
