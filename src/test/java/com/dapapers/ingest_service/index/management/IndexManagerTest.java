package com.dapapers.ingest_service.index.management;

import static org.junit.jupiter.api.Assertions.*;

import com.dapapers.ingest_service.analysis.AnalyzerManager;
import com.dapapers.ingest_service.analysis.AuthorNameAnalyzer;
import com.dapapers.ingest_service.analysis.PaperTextAnalyzer;
import com.dapapers.ingest_service.index.IndexName;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.KeepOnlyLastCommitDeletionPolicy;
import org.apache.lucene.search.IndexSearcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexManagerTest {

  @TempDir Path tempDir;

  private IndexManager indexManager;
  private Path indexPath;

  @BeforeEach
  void setUp() {
    indexManager =
        new IndexManager(
            new IndexContainer(),
            new AnalyzerManager(new PaperTextAnalyzer(), new AuthorNameAnalyzer()));
    indexPath = tempDir.resolve("papers");
    indexManager.openIndex(IndexName.PAPERS, indexPath);
  }

  @AfterEach
  void tearDown() {
    indexManager.closeAll();
  }

  private static Document doc(String id) {
    Document doc = new Document();
    doc.add(new StringField("id", id, Field.Store.YES));
    return doc;
  }

  private int visibleDocs() throws IOException {
    IndexSearcher searcher = indexManager.acquireSearcher(IndexName.PAPERS);
    try {
      return searcher.getIndexReader().numDocs();
    } finally {
      indexManager.releaseSearcher(IndexName.PAPERS, searcher);
    }
  }

  @Test
  void openIndex_keepsOnlyLastCommit() throws IOException {
    assertTrue(
        indexManager.getIndexWriter(IndexName.PAPERS).getConfig().getIndexDeletionPolicy()
            instanceof KeepOnlyLastCommitDeletionPolicy);

    indexManager.getIndexWriter(IndexName.PAPERS).addDocument(doc("a"));
    indexManager.commit(IndexName.PAPERS);
    indexManager.getIndexWriter(IndexName.PAPERS).addDocument(doc("b"));
    indexManager.commit(IndexName.PAPERS);

    try (Stream<Path> files = Files.list(indexPath)) {
      assertEquals(
          1, files.filter(f -> f.getFileName().toString().startsWith("segments_")).count());
    }
  }

  @Test
  void commit_newDocumentsVisibleToSearchers() throws IOException {
    assertEquals(0, visibleDocs());

    indexManager.getIndexWriter(IndexName.PAPERS).addDocument(doc("a"));
    assertEquals(0, visibleDocs());

    indexManager.commit(IndexName.PAPERS);
    assertEquals(1, visibleDocs());
  }

  @Test
  void closeIndex_thenReopen_documentsPersisted() throws IOException {
    indexManager.getIndexWriter(IndexName.PAPERS).addDocument(doc("a"));
    indexManager.commit(IndexName.PAPERS);

    indexManager.closeIndex(IndexName.PAPERS);
    assertFalse(indexManager.isOpen(IndexName.PAPERS));
    indexManager.openIndex(IndexName.PAPERS, indexPath);

    assertEquals(1, visibleDocs());
  }
}
