package com.dapapers.ingest_service.enrich;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.Sleeper;
import com.dapapers.ingest_service.config.EnrichmentProperties;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.google.common.base.Stopwatch;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fills in citation counts of stored arXiv papers.
 *
 * <p>Selections always take the first unenriched papers: every paper of a looked-up batch leaves
 * the selection, either with its count or with the checked sentinel. A failed lookup leaves the
 * batch untouched, waits for the cooldown and retries the same selection; too many consecutive
 * failures abort the run. Sentinels are reset to 0 when the run ends, aborted or not.
 */
@Slf4j
@Component
public class CitationEnrichmentJob {

  private final CitationStore store;
  private final CitationLookupClient lookupClient;
  private final Sleeper sleeper;
  private final EnrichmentProperties properties;

  public CitationEnrichmentJob(
      CitationStore store,
      CitationLookupClient lookupClient,
      Sleeper sleeper,
      EnrichmentProperties properties) {
    this.store = store;
    this.lookupClient = lookupClient;
    this.sleeper = sleeper;
    this.properties = properties;
  }

  public EnrichmentReport run() throws IOException {
    EnrichmentReport report = new EnrichmentReport();
    long unenriched = store.countUnenriched();
    long toProcess =
        properties.getLimit() > 0 ? Math.min(unenriched, properties.getLimit()) : unenriched;
    report.started(unenriched, toProcess);
    log.info("Papers needing enrichment: {}, processing up to {}", unenriched, toProcess);
    if (toProcess == 0) {
      return report;
    }

    int batchSize =
        Math.max(1, Math.min(properties.getBatchSize(), CitationLookupClient.MAX_IDS));
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      process(report, toProcess, batchSize);
    } finally {
      report.sentinelsReset(store.resetSentinels());
      log.info("Enrichment finished in {}: {}", stopwatch.stop(), report);
    }
    return report;
  }

  private void process(EnrichmentReport report, long toProcess, int batchSize)
      throws IOException {
    int consecutiveFailures = 0;
    while (report.getProcessed() < toProcess) {
      int size = (int) Math.min(batchSize, toProcess - report.getProcessed());
      List<UnenrichedPaper> batch = store.selectUnenriched(size);
      if (batch.isEmpty()) {
        break;
      }

      Map<String, Integer> counts;
      try {
        counts = lookupClient.lookup(batch.stream().map(UnenrichedPaper::arxivId).toList());
      } catch (ApiFetchException | SourceParseException e) {
        report.lookupFailed();
        consecutiveFailures++;
        if (consecutiveFailures >= properties.getMaxConsecutiveFailures()) {
          report.abort(consecutiveFailures + " consecutive failed lookups");
          log.error("Aborting enrichment after {} consecutive failures", consecutiveFailures, e);
          return;
        }
        log.warn(
            "Lookup failed ({} in a row), cooling down {} s: {}",
            consecutiveFailures,
            properties.getCooldown().toSeconds(),
            e.getMessage());
        if (!pause(properties.getCooldown(), report)) {
          return;
        }
        continue;
      }
      consecutiveFailures = 0;

      for (UnenrichedPaper paper : batch) {
        Integer count = counts.get(paper.arxivId());
        if (count != null && count > 0) {
          store.updateCitationCount(paper.documentId(), count);
          report.enriched();
        } else {
          store.markChecked(paper.documentId());
          report.notFound();
        }
      }
      store.flush();
      report.batchDone(batch.size());
      log.debug("Enrichment progress: {}", report);

      if (!pause(properties.getRateDelay(), report)) {
        return;
      }
    }
  }

  private boolean pause(Duration wait, EnrichmentReport report) {
    try {
      sleeper.sleep(wait);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      report.abort("interrupted");
      return false;
    }
  }
}
