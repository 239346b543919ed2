package com.dapapers.ingest_service.client;

/** One attempt of an upstream call, re-invoked by {@link RetryPolicy}. */
@FunctionalInterface
public interface ApiCall<T> {
  T call() throws ApiFetchException;
}
