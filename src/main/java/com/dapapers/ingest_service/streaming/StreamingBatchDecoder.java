package com.dapapers.ingest_service.streaming;

import com.fasterxml.jackson.databind.ObjectReader;
import com.google.common.base.Stopwatch;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.zip.GZIPInputStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes a gzip-compressed JSON Lines stream into batches of typed records.
 *
 * <p>Lines are read incrementally and never buffered beyond the line limit. Blank lines are
 * ignored, oversized and unparsable lines are counted and skipped, records rejected by the filter
 * are dropped. Accepted records are flushed to the callback every {@code batchSize} records and
 * once more at end of stream. An I/O failure or a callback failure stops the stream; it is returned
 * in {@link DecodeResult#failure()} together with the counters reached so far.
 */
@Slf4j
public class StreamingBatchDecoder {

  public static final int DEFAULT_MAX_LINE_BYTES = 32 * 1024 * 1024;
  public static final int DEFAULT_PROGRESS_EVERY = 5000;

  private final int maxLineBytes;
  private final int progressEvery;

  public StreamingBatchDecoder() {
    this(DEFAULT_MAX_LINE_BYTES, DEFAULT_PROGRESS_EVERY);
  }

  public StreamingBatchDecoder(int maxLineBytes, int progressEvery) {
    this.maxLineBytes = maxLineBytes;
    this.progressEvery = progressEvery <= 0 ? DEFAULT_PROGRESS_EVERY : progressEvery;
  }

  /** Decodes a gzip stream. See {@link #decodePlain} for the line rules. */
  public <T> DecodeResult decode(
      InputStream gzipStream,
      ObjectReader reader,
      Class<T> type,
      int batchSize,
      Predicate<? super T> filter,
      BatchCallback<T> callback) {
    GZIPInputStream gzip;
    try {
      gzip = new GZIPInputStream(gzipStream, 64 * 1024);
    } catch (IOException e) {
      log.warn("Not a gzip stream: {}", e.getMessage());
      return new DecodeResult(0, 0, 0, 0, e);
    }
    return decodePlain(gzip, reader, type, batchSize, filter, callback);
  }

  /**
   * Decodes an uncompressed JSON Lines stream.
   *
   * @param reader configured Jackson reader
   * @param type record type each line binds to
   * @param batchSize records per callback invocation, at least 1
   * @param filter records failing the predicate are skipped; null keeps everything
   */
  public <T> DecodeResult decodePlain(
      InputStream stream,
      ObjectReader reader,
      Class<T> type,
      int batchSize,
      Predicate<? super T> filter,
      BatchCallback<T> callback) {
    int size = Math.max(1, batchSize);
    ObjectReader typedReader = reader.forType(type);
    List<T> batch = new ArrayList<>(size);
    long matched = 0;
    long scanned = 0;
    long malformed = 0;
    long oversized = 0;
    Stopwatch stopwatch = Stopwatch.createStarted();

    try (BoundedLineReader lines = new BoundedLineReader(stream, maxLineBytes)) {
      BoundedLineReader.Line line;
      while ((line = lines.next()) != null) {
        scanned++;
        if (line.oversized()) {
          oversized++;
          log.warn("Skipping line {} longer than {} bytes", scanned, maxLineBytes);
          continue;
        }
        if (line.isBlank()) {
          continue;
        }
        T value;
        try {
          value = typedReader.readValue(line.bytes(), 0, line.length());
        } catch (IOException e) {
          malformed++;
          log.debug("Skipping malformed line {}: {}", scanned, e.getMessage());
          continue;
        }
        if (value == null) {
          malformed++;
          continue;
        }
        if (filter != null && !filter.test(value)) {
          continue;
        }
        batch.add(value);
        matched++;
        if (batch.size() >= size) {
          callback.process(batch);
          batch.clear();
        }
        if (matched % progressEvery == 0) {
          long seconds = Math.max(1, stopwatch.elapsed(TimeUnit.SECONDS));
          log.info(
              "Progress: {} matched / {} scanned ({} matched/sec)",
              matched,
              scanned,
              matched / seconds);
        }
      }
      if (!batch.isEmpty()) {
        callback.process(batch);
        batch.clear();
      }
    } catch (Exception e) {
      log.warn("Stream stopped after {} matched records: {}", matched, e.getMessage());
      return new DecodeResult(matched, scanned, malformed, oversized, e);
    }
    return new DecodeResult(matched, scanned, malformed, oversized, null);
  }
}
