package com.dapapers.ingest_service.index.management;

import com.dapapers.ingest_service.analysis.AnalyzerManager;
import com.dapapers.ingest_service.index.IndexName;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.KeepOnlyLastCommitDeletionPolicy;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Component;

/**
 * Manages Lucene index resources: opens writers and searcher managers, commits, refreshes and
 * closes them. Resources are kept in the {@link IndexContainer}. Searchers see new documents after
 * {@link #commit}, which refreshes the searcher manager.
 */
@Slf4j
@Component
public class IndexManager {

  private final IndexContainer container;
  private final AnalyzerManager analyzerManager;

  public IndexManager(IndexContainer container, AnalyzerManager analyzerManager) {
    this.container = container;
    this.analyzerManager = analyzerManager;
  }

  /**
   * Opens (creating it if needed) the Lucene index at {@code indexPath} and registers its writer
   * and searcher manager in the container. Keeps only the last commit.
   *
   * @throws IllegalStateException if the index cannot be opened
   */
  public synchronized void openIndex(IndexName indexName, Path indexPath) {
    String indexNameStr = indexName.getIndexName();
    if (container.indexWriterExists(indexName)) {
      log.debug("Index {} already open", indexNameStr);
      return;
    }
    log.info("Opening index {} [{}]", indexNameStr, indexPath);
    try {
      FSDirectory indexDirectory = FSDirectory.open(indexPath);
      IndexWriterConfig writerConfig =
          new IndexWriterConfig(analyzerManager.getPerFieldAnalyzerWrapper());
      writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
      writerConfig.setIndexDeletionPolicy(new KeepOnlyLastCommitDeletionPolicy());
      IndexWriter writer = new IndexWriter(indexDirectory, writerConfig);
      // Persist an empty commit so a freshly created index is visible on disk.
      writer.commit();
      container.setIndexWriter(indexName, writer);

      SearcherManager manager = new SearcherManager(writer, new SearcherFactory());
      container.setSearcherManager(indexName, manager);

      log.info("Index {} [{}] open and ready", indexNameStr, indexPath);
    } catch (IOException e) {
      log.error("Error opening index {} [{}]", indexNameStr, indexPath, e);
      throw new IllegalStateException("Failed to open required index: " + indexNameStr, e);
    }
  }

  public boolean isOpen(IndexName indexName) {
    return container.indexWriterExists(indexName);
  }

  public IndexWriter getIndexWriter(IndexName indexName) {
    return container.getIndexWriter(indexName);
  }

  public IndexSearcher acquireSearcher(IndexName indexName) throws IOException {
    return container.acquireSearcher(indexName);
  }

  public void releaseSearcher(IndexName indexName, IndexSearcher searcher) throws IOException {
    container.releaseSearcher(indexName, searcher);
  }

  /** Commits pending changes with the commit time as live commit data, then refreshes. */
  public void commit(IndexName indexName) throws IOException {
    IndexWriter writer = container.getIndexWriter(indexName);
    writer.setLiveCommitData(
        Map.of("updateTime", String.valueOf(Instant.now().toEpochMilli())).entrySet());
    writer.commit();
    container.getSearcherManager(indexName).maybeRefreshBlocking();
  }

  /** Closes the writer and searcher manager of one index. No-op if not open. */
  public synchronized void closeIndex(IndexName indexName) throws IOException {
    SearcherManager manager = container.removeSearcherManager(indexName);
    if (manager != null) {
      manager.close();
    }
    IndexWriter writer = container.removeIndexWriter(indexName);
    if (writer != null) {
      writer.close();
      writer.getDirectory().close();
      log.info("Index {} closed", indexName.getIndexName());
    }
  }

  @PreDestroy
  public void closeAll() {
    log.info("Closing all Lucene index resources...");
    for (IndexName indexName : IndexName.values()) {
      try {
        closeIndex(indexName);
      } catch (IOException e) {
        log.error("Close failed for index {}", indexName.getIndexName(), e);
      }
    }
  }
}
