package com.dapapers.ingest_service.driver;

import com.dapapers.ingest_service.streaming.DecodeResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/** Totals of a bulk dataset import across all files. */
@Getter
public class DatasetImportReport {

  private int filesTotal;
  private int filesProcessed;
  private final List<Integer> failedFiles = new ArrayList<>();
  private long scanned;
  private long matched;
  private long malformed;
  private long oversized;
  private long converted;
  private long skipped;
  private long indexed;
  private long errors;

  void filesListed(int count) {
    filesTotal = count;
  }

  void fileDecoded(DecodeResult result) {
    filesProcessed++;
    scanned += result.scanned();
    matched += result.matched();
    malformed += result.malformed();
    oversized += result.oversized();
  }

  void fileFailed(int fileIndex) {
    failedFiles.add(fileIndex);
  }

  void batchIndexed(long convertedInBatch, long skippedInBatch, long accepted, long rejected) {
    converted += convertedInBatch;
    skipped += skippedInBatch;
    indexed += accepted;
    errors += rejected;
  }

  public List<Integer> getFailedFiles() {
    return Collections.unmodifiableList(failedFiles);
  }

  public boolean hasFailures() {
    return !failedFiles.isEmpty();
  }

  @Override
  public String toString() {
    return String.format(
        "files %d/%d (failed %s), scanned %d, matched %d, malformed %d, oversized %d,"
            + " indexed %d, errors %d, skipped %d",
        filesProcessed,
        filesTotal,
        failedFiles,
        scanned,
        matched,
        malformed,
        oversized,
        indexed,
        errors,
        skipped);
  }
}
