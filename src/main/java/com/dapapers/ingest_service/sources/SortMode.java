package com.dapapers.ingest_service.sources;

/** Result ordering supported by the search adapters that can sort. */
public enum SortMode {
  /** Upstream default; no sort parameter is sent. */
  RELEVANCE,
  CITATION_COUNT,
  PUBLICATION_DATE
}
