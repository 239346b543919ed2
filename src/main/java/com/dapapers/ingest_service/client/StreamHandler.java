package com.dapapers.ingest_service.client;

import java.io.IOException;
import java.io.InputStream;

/**
 * Consumes a response body while the connection is open. Closing the body is left to the caller
 * of the handler, which may abort the connection instead.
 */
@FunctionalInterface
public interface StreamHandler<T> {
  T handle(InputStream body) throws IOException;
}
