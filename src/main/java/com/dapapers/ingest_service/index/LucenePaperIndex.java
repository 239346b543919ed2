package com.dapapers.ingest_service.index;

import com.dapapers.ingest_service.index.management.IndexManager;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.NumericDocValues;
import org.apache.lucene.index.ReaderUtil;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * {@link PaperIndex} over a local Lucene index.
 *
 * <p>Each record is written with {@code updateDocument(id, doc)}. A document Lucene refuses (for
 * example a keyword over the 32766-byte term limit) is logged and counted, and the rest of the
 * batch continues. Every bulk call ends with a commit and a searcher refresh.
 */
@Slf4j
@Component
public class LucenePaperIndex implements PaperIndex {

  private static final IndexName INDEX = IndexName.PAPERS;

  private final IndexManager indexManager;
  private final LuceneIndexConfig indexConfig;
  private final PaperDocumentFactory documentFactory;

  public LucenePaperIndex(
      IndexManager indexManager,
      LuceneIndexConfig indexConfig,
      PaperDocumentFactory documentFactory) {
    this.indexManager = indexManager;
    this.indexConfig = indexConfig;
    this.documentFactory = documentFactory;
  }

  @Override
  public void createIndexIfAbsent() {
    indexManager.openIndex(INDEX, indexConfig.getIndexPath(INDEX));
  }

  @Override
  public void deleteIndex() throws IOException {
    indexManager.closeIndex(INDEX);
    Path path = indexConfig.getIndexPath(INDEX);
    if (Files.exists(path)) {
      FileSystemUtils.deleteRecursively(path);
      log.info("Deleted index {} [{}]", INDEX.getIndexName(), path);
    } else {
      log.info("Index {} does not exist, nothing to delete", INDEX.getIndexName());
    }
  }

  @Override
  public long getDocumentCount() throws IOException {
    IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
    try {
      return searcher.getIndexReader().numDocs();
    } finally {
      indexManager.releaseSearcher(INDEX, searcher);
    }
  }

  @Override
  public BulkIndexResult bulkIndex(List<PaperRecord> papers) throws IOException {
    if (papers == null || papers.isEmpty()) {
      return BulkIndexResult.EMPTY;
    }
    IndexWriter writer = indexManager.getIndexWriter(INDEX);
    int accepted = 0;
    for (PaperRecord paper : papers) {
      if (paper == null || !paper.isIndexable()) {
        log.debug("Skipping record without title or external id: {}", paper);
        continue;
      }
      try {
        writer.updateDocument(new Term(PaperFields.ID, paper.id()), documentFactory.create(paper));
        accepted++;
      } catch (IllegalArgumentException e) {
        log.warn("Document {} rejected by the index: {}", paper.id(), e.getMessage());
      }
    }
    indexManager.commit(INDEX);
    return new BulkIndexResult(papers.size(), accepted);
  }

  @Override
  public Optional<PaperRecord> findById(String id) throws IOException {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    return findFirst(new TermQuery(new Term(PaperFields.ID, id)));
  }

  @Override
  public Optional<PaperRecord> findByExternalId(PaperSource source, String externalId)
      throws IOException {
    if (source == null || externalId == null || externalId.isBlank()) {
      return Optional.empty();
    }
    Query query =
        new BooleanQuery.Builder()
            .add(new TermQuery(new Term(PaperFields.SOURCE, source.getTag())), BooleanClause.Occur.FILTER)
            .add(new TermQuery(new Term(PaperFields.EXTERNAL_ID, externalId)), BooleanClause.Occur.FILTER)
            .build();
    return findFirst(query);
  }

  private Optional<PaperRecord> findFirst(Query query) throws IOException {
    IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
    try {
      TopDocs hits = searcher.search(query, 1);
      if (hits.scoreDocs.length == 0) {
        return Optional.empty();
      }
      ScoreDoc hit = hits.scoreDocs[0];
      Document stored = searcher.storedFields().document(hit.doc);
      return Optional.of(documentFactory.read(stored, citationCount(searcher, hit.doc)));
    } finally {
      indexManager.releaseSearcher(INDEX, searcher);
    }
  }

  /** Reads the doc-values citation count of a top-level doc id. */
  static long citationCount(IndexSearcher searcher, int docId) throws IOException {
    List<LeafReaderContext> leaves = searcher.getIndexReader().leaves();
    LeafReaderContext leaf = leaves.get(ReaderUtil.subIndex(docId, leaves));
    NumericDocValues values = leaf.reader().getNumericDocValues(PaperFields.CITATION_COUNT);
    if (values != null && values.advanceExact(docId - leaf.docBase)) {
      return values.longValue();
    }
    return 0;
  }
}
