package com.dapapers.ingest_service.index;

/**
 * Lucene indexes of the ingestion service. Each constant is the directory name of the index under
 * {@code index.base-dir}.
 */
public enum IndexName {
  /** Canonical paper records from every source. */
  PAPERS("papers"),
  ;

  private final String indexName;

  IndexName(String indexName) {
    this.indexName = indexName;
  }

  public String getIndexName() {
    return indexName;
  }
}
