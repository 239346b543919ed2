package com.dapapers.ingest_service.index;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Location of the Lucene index directories. */
@Component
public class LuceneIndexConfig {

  /** Base directory path where Lucene indices are physically located. */
  private final String baseDir;

  public LuceneIndexConfig(@Value("${index.base-dir}") String baseDir) {
    this.baseDir = baseDir;
  }

  /**
   * Returns the full file system path to an individual Lucene index directory.
   *
   * @param indexName the index to get the path for
   * @return the full directory path
   */
  public Path getIndexPath(IndexName indexName) {
    return Paths.get(baseDir).resolve(indexName.getIndexName());
  }
}
