package com.dapapers.ingest_service.sources;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.model.SearchResult;
import java.util.Optional;

/**
 * Converts one bibliographic API into canonical {@link PaperRecord}s.
 *
 * <p>Records without a title or without a resolvable external id are dropped by the adapter; the
 * reported total is the upstream hit count and may therefore exceed the returned page.
 */
public interface PaperSourceAdapter {

  int DEFAULT_LIMIT = 20;
  int MAX_LIMIT = 100;

  PaperSource source();

  /**
   * Relevance search.
   *
   * @param limit page size; values below 1 become {@value #DEFAULT_LIMIT}, values above {@value
   *     #MAX_LIMIT} are capped
   * @param offset number of hits to skip
   */
  SearchResult search(String query, int limit, int offset) throws ApiFetchException;

  /** Looks up one record by the id native to this source. */
  Optional<PaperRecord> fetchById(String id) throws ApiFetchException;

  static int clampLimit(int limit) {
    if (limit <= 0) {
      return DEFAULT_LIMIT;
    }
    return Math.min(limit, MAX_LIMIT);
  }
}
