package com.dapapers.ingest_service.driver;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dapapers.ingest_service.TestFixtures;
import com.dapapers.ingest_service.TestFixtures.RecordingSleeper;
import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.index.BulkIndexResult;
import com.dapapers.ingest_service.index.PaperIndex;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.SourceParseException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

@ExtendWith(MockitoExtension.class)
class CursorImportDriverTest {

  @Mock private PaperIndex paperIndex;

  private RecordingSleeper sleeper;
  private CursorImportDriver driver;
  private ScriptedSource source;

  private static final Answer<BulkIndexResult> ACCEPT_ALL =
      inv -> {
        List<?> batch = inv.getArgument(0);
        return new BulkIndexResult(batch.size(), batch.size());
      };

  @BeforeEach
  void setUp() {
    sleeper = new RecordingSleeper();
    IngestProperties properties = new IngestProperties();
    properties.setBatchSize(2);
    properties.setPageDelay(Duration.ofMillis(120));
    driver =
        new CursorImportDriver(
            paperIndex, TestFixtures.retryPolicies(sleeper), sleeper, properties);
    source = new ScriptedSource();
  }

  @Test
  void run_walksEveryPageUntilNoNextCursor() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 3, "a", "b"));
    source.on("c2", page(null, 3, "c"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertTrue(progress.isFinished());
    assertEquals(2, progress.getPages());
    assertEquals(3, progress.getIndexed());
    assertEquals(0, progress.getErrors());
    assertEquals(3, progress.getTotal());
    assertEquals(100.0, progress.percent());
    assertEquals(List.of("*", "c2"), source.requested);
    assertEquals(List.of(Duration.ofMillis(120)), sleeper.getWaits());
  }

  @Test
  void run_emptyPage_completesWithoutIndexing() throws IOException {
    source.on("*", page("c2", 0));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(0, progress.getPages());
    verify(paperIndex, never()).bulkIndex(anyList());
  }

  @Test
  void run_transientFailures_retriedAndImportCompletes() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on(
        "*",
        new ApiFetchException("HTTP 503", 503),
        new ApiFetchException("reset"),
        page(null, 1, "a"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(1, progress.getIndexed());
    assertEquals(3, source.requested.size());
  }

  @Test
  void run_retriesExhausted_abortsWithFailingCursorAsResumePoint() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 10, "a", "b"));
    ApiFetchException down = new ApiFetchException("HTTP 500", 500);
    source.on("c2", down, down, down, down, down);

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.ABORTED, progress.getState());
    assertFalse(progress.isFinished());
    assertEquals("c2", progress.getResumeCursor());
    assertEquals(1, progress.getPages());
    assertEquals(2, progress.getIndexed());
    assertTrue(progress.getMessage().contains("HTTP 500"));
  }

  @Test
  void run_unparsablePage_abortsWithoutRetry() {
    source.on("*", new SourceParseException("not json"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.ABORTED, progress.getState());
    assertEquals("*", progress.getResumeCursor());
    assertEquals(1, source.requested.size());
  }

  @Test
  void run_partialAcceptance_countedAsErrorsAndRunContinues() throws IOException {
    when(paperIndex.bulkIndex(anyList()))
        .thenReturn(new BulkIndexResult(2, 1))
        .thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 4, "a", "b"));
    source.on("c2", page(null, 4, "c", "d"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(3, progress.getIndexed());
    assertEquals(1, progress.getErrors());
  }

  @Test
  void run_bulkIndexThrows_wholeBatchCountedAsErrors() throws IOException {
    when(paperIndex.bulkIndex(anyList()))
        .thenThrow(new IOException("disk full"))
        .thenAnswer(ACCEPT_ALL);
    source.on("*", page(null, 3, "a", "b", "c"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(2, progress.getErrors());
    assertEquals(1, progress.getIndexed());
  }

  @Test
  void run_pageLargerThanBatch_indexedInSubBatches() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page(null, 5, "a", "b", "c", "d", "e"));

    ImportProgress progress = driver.run(source, "*");

    verify(paperIndex, times(3)).bulkIndex(anyList());
    assertEquals(5, progress.getIndexed());
  }

  @Test
  void run_unconvertibleItems_skipped() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page(null, 3, "a", ScriptedSource.UNCONVERTIBLE, "b"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(1, progress.getSkipped());
    assertEquals(2, progress.getConverted());
    assertEquals(2, progress.getIndexed());
  }

  @Test
  void run_unreadableRecordsOnPage_skippedAndRunContinues() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", new CursorPage<>(List.of("a"), "c2", 4, 1));
    source.on("c2", page(null, 4, "b", "c"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(1, progress.getSkipped());
    assertEquals(3, progress.getIndexed());
    assertEquals(List.of("*", "c2"), source.requested);
  }

  @Test
  void run_pageWithOnlyUnreadableRecords_notTreatedAsLastPage() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", new CursorPage<String>(List.of(), "c2", 3, 2));
    source.on("c2", page(null, 3, "a"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(2, progress.getSkipped());
    assertEquals(1, progress.getIndexed());
  }

  @Test
  void run_conversionThrows_recordSkippedAndRunContinues() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 3, "a", ScriptedSource.EXPLODING));
    source.on("c2", page(null, 3, "b"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(1, progress.getSkipped());
    assertEquals(2, progress.getIndexed());
  }

  @Test
  void run_nullItemOnPage_countedAsSkipped() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page(null, 2, "a", null));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(1, progress.getSkipped());
    assertEquals(1, progress.getIndexed());
  }

  @Test
  void run_unexpectedFailureFetchingPage_abortsWithResumeCursor() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 10, "a"));
    source.on("c2", new NullPointerException("meta"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.ABORTED, progress.getState());
    assertEquals("c2", progress.getResumeCursor());
  }

  @Test
  void run_stopRequestedBeforeRun_honouredOnce() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page(null, 1, "a"));
    driver.requestStop();

    ImportProgress stopped = driver.run(source, "*");
    ImportProgress resumed = driver.run(source, stopped.getResumeCursor());

    assertEquals(ImportState.STOPPED, stopped.getState());
    assertEquals("*", stopped.getResumeCursor());
    assertEquals(ImportState.COMPLETED, resumed.getState());
    assertEquals(List.of("*"), source.requested);
  }

  @Test
  void run_stopRequested_stopsBeforeNextPageWithResumeCursor() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.on("*", page("c2", 10, "a"));
    source.on("c2", page("c3", 10, "b"));
    source.afterFetch = driver::requestStop;

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.STOPPED, progress.getState());
    assertEquals("c2", progress.getResumeCursor());
    assertEquals(List.of("*"), source.requested);
  }

  @Test
  void run_sourceAsksForLongerInterval_waitsThatLong() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    source.minInterval = Duration.ofSeconds(3);
    source.on("*", page("c2", 3, "a"));
    source.on("c2", page("c3", 3, "b"));
    source.on("c3", page(null, 3, "c"));

    ImportProgress progress = driver.run(source, "*");

    assertEquals(ImportState.COMPLETED, progress.getState());
    assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3)), sleeper.getWaits());
  }

  @Test
  void run_interruptedDuringPageDelay_stops() throws IOException {
    when(paperIndex.bulkIndex(anyList())).thenAnswer(ACCEPT_ALL);
    IngestProperties properties = new IngestProperties();
    CursorImportDriver interrupted =
        new CursorImportDriver(
            paperIndex,
            TestFixtures.retryPolicies(),
            d -> {
              throw new InterruptedException();
            },
            properties);
    source.on("*", page("c2", 10, "a"));

    ImportProgress progress = interrupted.run(source, "*");

    assertEquals(ImportState.STOPPED, progress.getState());
    assertEquals("c2", progress.getResumeCursor());
    assertTrue(Thread.interrupted());
  }

  private static CursorPage<String> page(String next, long total, String... items) {
    return new CursorPage<>(Arrays.asList(items), next, total);
  }

  /** Answers each cursor with scripted pages or failures, in order. */
  private static class ScriptedSource implements CursorPageSource<String> {

    static final String UNCONVERTIBLE = "untitled";
    static final String EXPLODING = "exploding";

    private final Map<String, Deque<Object>> responses = new HashMap<>();
    final List<String> requested = new ArrayList<>();
    Runnable afterFetch = () -> {};
    Duration minInterval = Duration.ZERO;

    void on(String cursor, Object... answers) {
      responses.computeIfAbsent(cursor, c -> new ArrayDeque<>()).addAll(Arrays.asList(answers));
    }

    @Override
    public String name() {
      return "scripted";
    }

    @Override
    public Duration minPageInterval() {
      return minInterval;
    }

    @Override
    @SuppressWarnings("unchecked")
    public CursorPage<String> fetchPage(String cursor) throws ApiFetchException {
      requested.add(cursor);
      Deque<Object> queue = responses.get(cursor);
      if (queue == null || queue.isEmpty()) {
        throw new IllegalStateException("Unexpected cursor " + cursor);
      }
      Object answer = queue.poll();
      if (answer instanceof ApiFetchException e) {
        throw e;
      }
      if (answer instanceof RuntimeException e) {
        throw e;
      }
      afterFetch.run();
      return (CursorPage<String>) answer;
    }

    @Override
    public Optional<PaperRecord> convert(String item) {
      if (UNCONVERTIBLE.equals(item)) {
        return Optional.empty();
      }
      if (EXPLODING.equals(item)) {
        throw new IllegalArgumentException("bad author list");
      }
      return Optional.of(
          PaperRecord.builder()
              .id(item)
              .externalId(item)
              .source(PaperSource.ARXIV)
              .title("Paper " + item)
              .build());
    }
  }
}
