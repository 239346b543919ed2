package com.dapapers.ingest_service.index;

/**
 * Outcome of one bulk index call.
 *
 * @param submitted records handed to the indexer
 * @param accepted records actually written
 */
public record BulkIndexResult(int submitted, int accepted) {

  public static final BulkIndexResult EMPTY = new BulkIndexResult(0, 0);

  public int errors() {
    return submitted - accepted;
  }
}
