package com.dapapers.ingest_service.index.management;

import com.dapapers.ingest_service.index.IndexName;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.springframework.stereotype.Component;

/**
 * Open writers and searcher managers per {@link IndexName}. Opening and closing is done by
 * {@link IndexManager}; callers only look handles up.
 */
@Slf4j
@Component
public class IndexContainer {

  private final Map<IndexName, IndexWriter> writers = new ConcurrentHashMap<>();
  private final Map<IndexName, SearcherManager> searchers = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if the index is not open
   */
  public IndexWriter getIndexWriter(IndexName indexName) {
    return require(writers, indexName, "IndexWriter");
  }

  /**
   * @throws IllegalStateException if the index is not open
   */
  public SearcherManager getSearcherManager(IndexName indexName) {
    return require(searchers, indexName, "SearcherManager");
  }

  public void setIndexWriter(IndexName indexName, IndexWriter indexWriter) {
    writers.put(indexName, indexWriter);
    log.info("Writer registered for index {}", indexName.getIndexName());
  }

  public void setSearcherManager(IndexName indexName, SearcherManager manager) {
    searchers.put(indexName, manager);
    log.debug("SearcherManager registered for index {}", indexName.getIndexName());
  }

  public boolean indexWriterExists(IndexName indexName) {
    return writers.containsKey(indexName);
  }

  /** Every acquired searcher must be handed back through {@link #releaseSearcher}. */
  public IndexSearcher acquireSearcher(IndexName indexName) throws IOException {
    return getSearcherManager(indexName).acquire();
  }

  public void releaseSearcher(IndexName indexName, IndexSearcher searcher) throws IOException {
    getSearcherManager(indexName).release(searcher);
  }

  /** Null when no writer was registered. */
  IndexWriter removeIndexWriter(IndexName indexName) {
    return writers.remove(indexName);
  }

  /** Null when no searcher manager was registered. */
  SearcherManager removeSearcherManager(IndexName indexName) {
    return searchers.remove(indexName);
  }

  private static <T> T require(Map<IndexName, T> handles, IndexName indexName, String kind) {
    T handle = handles.get(indexName);
    if (handle == null) {
      String message =
          kind + " requested for index " + indexName.getIndexName() + ", which is not open";
      log.error(message);
      throw new IllegalStateException(message);
    }
    return handle;
  }
}
