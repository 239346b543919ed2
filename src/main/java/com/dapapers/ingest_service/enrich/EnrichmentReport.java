package com.dapapers.ingest_service.enrich;

import lombok.Getter;

/** Counters of one enrichment run. */
@Getter
public class EnrichmentReport {

  private long unenriched;
  private long toProcess;
  private long processed;
  private long enriched;
  private long notFound;
  private long failedLookups;
  private long sentinelsReset;
  private boolean aborted;
  private String abortReason = "";

  void started(long unenrichedCount, long toProcessCount) {
    this.unenriched = unenrichedCount;
    this.toProcess = toProcessCount;
  }

  void enriched() {
    enriched++;
  }

  void notFound() {
    notFound++;
  }

  void batchDone(int size) {
    processed += size;
  }

  void lookupFailed() {
    failedLookups++;
  }

  void abort(String reason) {
    aborted = true;
    abortReason = reason;
  }

  void sentinelsReset(long count) {
    sentinelsReset = count;
  }

  @Override
  public String toString() {
    return String.format(
        "processed %d/%d, enriched %d, not found %d, failed lookups %d, sentinels reset %d%s",
        processed,
        toProcess,
        enriched,
        notFound,
        failedLookups,
        sentinelsReset,
        aborted ? ", aborted: " + abortReason : "");
  }
}
