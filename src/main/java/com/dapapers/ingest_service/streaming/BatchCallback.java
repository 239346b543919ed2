package com.dapapers.ingest_service.streaming;

import java.io.IOException;
import java.util.List;

/**
 * Receives decoded records in batches. The list is only valid during the call.
 *
 * @param <T> type of the decoded records
 */
@FunctionalInterface
public interface BatchCallback<T> {
  void process(List<T> batch) throws IOException;
}
