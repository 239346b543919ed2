package com.dapapers.ingest_service.driver;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.client.Sleeper;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.index.BulkIndexResult;
import com.dapapers.ingest_service.index.PaperIndex;
import com.dapapers.ingest_service.model.PaperRecord;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Walks a {@link CursorPageSource} page by page and writes every page to the paper index.
 *
 * <p>Page fetches go through the paging {@link RetryPolicy}. When retries are exhausted, or a page
 * cannot be parsed, the run ends in {@link ImportState#ABORTED} and {@link
 * ImportProgress#getResumeCursor()} is the cursor of that page, so a new run started from it
 * repeats no indexed page. Unreadable records and records that fail conversion are counted as
 * skipped; indexing shortfalls are counted as errors. Neither stops the run.
 */
@Slf4j
@Component
public class CursorImportDriver {

  private static final int ALWAYS_LOGGED_PAGES = 5;

  private final PaperIndex paperIndex;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final int batchSize;
  private final Duration pageDelay;
  private final int progressEveryPages;

  private volatile boolean stopRequested;

  public CursorImportDriver(
      PaperIndex paperIndex,
      RetryPolicies retryPolicies,
      Sleeper sleeper,
      IngestProperties properties) {
    this.paperIndex = paperIndex;
    this.retryPolicy = retryPolicies.paging();
    this.sleeper = sleeper;
    this.batchSize = Math.max(1, properties.getBatchSize());
    this.pageDelay = properties.getPageDelay();
    this.progressEveryPages = Math.max(1, properties.getProgressEveryPages());
  }

  /**
   * Asks the running import, or the next one when none is running, to stop before fetching its
   * next page.
   */
  public void requestStop() {
    stopRequested = true;
  }

  public <T> ImportProgress run(CursorPageSource<T> source, String startCursor) {
    ImportProgress progress = new ImportProgress(source.name(), startCursor);
    log.info("Starting {} import from cursor {}", source.name(), startCursor);
    String cursor = startCursor;

    while (true) {
      if (stopRequested) {
        stopRequested = false;
        progress.stop("stop requested");
        log.info("{} import stopped; resume from cursor {}", source.name(), cursor);
        break;
      }

      String pageCursor = cursor;
      CursorPage<T> page;
      try {
        page = retryPolicy.execute(source.name() + " page", () -> source.fetchPage(pageCursor));
      } catch (ApiFetchException | RuntimeException e) {
        progress.abort(e.getMessage());
        log.error(
            "{} import aborted after {} pages; resume from cursor {}",
            source.name(),
            progress.getPages(),
            pageCursor,
            e);
        break;
      }

      progress.pageFetched(page.total());
      if (page.isEmpty()) {
        progress.complete();
        break;
      }

      indexPage(source, page, progress);
      if (progress.getPages() <= ALWAYS_LOGGED_PAGES
          || progress.getPages() % progressEveryPages == 0) {
        log.info("{}", progress);
      }

      if (!page.hasNext()) {
        progress.complete();
        break;
      }
      cursor = page.nextCursor();
      progress.advanceTo(cursor);

      if (!pause(source)) {
        progress.stop("interrupted");
        break;
      }
    }

    log.info(
        "{} import finished in state {} after {}: {}",
        source.name(),
        progress.getState(),
        progress.elapsed(),
        progress);
    return progress;
  }

  private <T> void indexPage(
      CursorPageSource<T> source, CursorPage<T> page, ImportProgress progress) {
    List<PaperRecord> records = new ArrayList<>(page.items().size());
    long skipped = page.unreadable();
    for (T item : page.items()) {
      Optional<PaperRecord> record;
      try {
        record = source.convert(item);
      } catch (RuntimeException e) {
        log.warn("Skipping {} record that failed conversion: {}", source.name(), e.toString());
        record = Optional.empty();
      }
      if (record.isPresent()) {
        records.add(record.get());
      } else {
        skipped++;
      }
    }

    long indexed = 0;
    long errors = 0;
    for (int from = 0; from < records.size(); from += batchSize) {
      List<PaperRecord> batch = records.subList(from, Math.min(records.size(), from + batchSize));
      try {
        BulkIndexResult result = paperIndex.bulkIndex(batch);
        indexed += result.accepted();
        errors += result.errors();
      } catch (IOException | RuntimeException e) {
        errors += batch.size();
        log.warn("Bulk index of {} records failed: {}", batch.size(), e.getMessage());
      }
    }
    progress.pageDone(records.size(), skipped, indexed, errors);
  }

  private boolean pause(CursorPageSource<?> source) {
    Duration wait = pageDelay;
    if (source.minPageInterval().compareTo(wait) > 0) {
      wait = source.minPageInterval();
    }
    try {
      sleeper.sleep(wait);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
