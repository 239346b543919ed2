package com.dapapers.ingest_service.streaming;

/**
 * Counters of one decoded stream.
 *
 * @param matched records that passed the filter and were handed to the callback
 * @param scanned lines read, blank and discarded ones included
 * @param malformed lines that were not valid JSON for the target type
 * @param oversized lines longer than the line limit
 * @param failure I/O or callback failure that ended the stream early, or null when the whole
 *     stream was read
 */
public record DecodeResult(long matched, long scanned, long malformed, long oversized, Exception failure) {

  public boolean isComplete() {
    return failure == null;
  }
}
