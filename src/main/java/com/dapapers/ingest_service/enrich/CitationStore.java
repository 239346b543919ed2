package com.dapapers.ingest_service.enrich;

import java.io.IOException;
import java.util.List;

/**
 * Citation counts of stored arXiv papers.
 *
 * <p>A paper is unenriched while its count is exactly 0. Papers checked without a result are set
 * to the {@link #CHECKED_SENTINEL} so the next selection skips them; {@link #resetSentinels()}
 * turns every sentinel back into 0. Updates become visible to selections after {@link #flush()}.
 */
public interface CitationStore {

  long CHECKED_SENTINEL = -1;

  long countUnenriched() throws IOException;

  /** Up to {@code limit} unenriched papers ordered by arXiv id. */
  List<UnenrichedPaper> selectUnenriched(int limit) throws IOException;

  void updateCitationCount(String documentId, long citationCount) throws IOException;

  /** Sets the sentinel, only when the stored count is still 0. */
  void markChecked(String documentId) throws IOException;

  void flush() throws IOException;

  /** Resets every sentinel to 0 and returns how many were reset. */
  long resetSentinels() throws IOException;
}
