package com.dapapers.ingest_service.model;

import java.util.List;

/**
 * One page of adapter results.
 *
 * @param papers converted records, never null
 * @param total total hits reported by the upstream API
 */
public record SearchResult(List<PaperRecord> papers, long total) {

  public SearchResult {
    papers = papers == null ? List.of() : List.copyOf(papers);
  }

  public static SearchResult empty(long total) {
    return new SearchResult(List.of(), total);
  }
}
