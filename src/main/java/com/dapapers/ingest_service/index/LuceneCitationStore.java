package com.dapapers.ingest_service.index;

import com.dapapers.ingest_service.enrich.CitationStore;
import com.dapapers.ingest_service.enrich.UnenrichedPaper;
import com.dapapers.ingest_service.index.management.IndexManager;
import com.dapapers.ingest_service.model.PaperSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Component;

/**
 * {@link CitationStore} over the paper index. Counts live in the {@link
 * PaperFields#CITATION_COUNT} numeric doc values, which are updated in place without
 * re-indexing the document.
 */
@Slf4j
@Component
public class LuceneCitationStore implements CitationStore {

  private static final IndexName INDEX = IndexName.PAPERS;
  private static final int RESET_PAGE = 1000;

  private final IndexManager indexManager;

  public LuceneCitationStore(IndexManager indexManager) {
    this.indexManager = indexManager;
  }

  @Override
  public long countUnenriched() throws IOException {
    IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
    try {
      return searcher.count(arxivWithCount(0));
    } finally {
      indexManager.releaseSearcher(INDEX, searcher);
    }
  }

  @Override
  public List<UnenrichedPaper> selectUnenriched(int limit) throws IOException {
    if (limit <= 0) {
      return List.of();
    }
    IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
    try {
      Sort byExternalId = new Sort(new SortField(PaperFields.EXTERNAL_ID, SortField.Type.STRING));
      TopDocs hits = searcher.search(arxivWithCount(0), limit, byExternalId);
      StoredFields storedFields = searcher.storedFields();
      List<UnenrichedPaper> papers = new ArrayList<>(hits.scoreDocs.length);
      for (ScoreDoc hit : hits.scoreDocs) {
        Document doc = storedFields.document(hit.doc);
        papers.add(new UnenrichedPaper(doc.get(PaperFields.ID), doc.get(PaperFields.EXTERNAL_ID)));
      }
      return papers;
    } finally {
      indexManager.releaseSearcher(INDEX, searcher);
    }
  }

  @Override
  public void updateCitationCount(String documentId, long citationCount) throws IOException {
    indexManager
        .getIndexWriter(INDEX)
        .updateNumericDocValue(
            new Term(PaperFields.ID, documentId), PaperFields.CITATION_COUNT, citationCount);
  }

  @Override
  public void markChecked(String documentId) throws IOException {
    if (currentCount(documentId) == 0) {
      updateCitationCount(documentId, CHECKED_SENTINEL);
    }
  }

  @Override
  public void flush() throws IOException {
    indexManager.commit(INDEX);
  }

  @Override
  public long resetSentinels() throws IOException {
    Query sentinels =
        NumericDocValuesField.newSlowExactQuery(PaperFields.CITATION_COUNT, CHECKED_SENTINEL);
    long reset = 0;
    while (true) {
      List<String> ids = new ArrayList<>();
      IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
      try {
        TopDocs hits = searcher.search(sentinels, RESET_PAGE);
        StoredFields storedFields = searcher.storedFields();
        for (ScoreDoc hit : hits.scoreDocs) {
          ids.add(storedFields.document(hit.doc).get(PaperFields.ID));
        }
      } finally {
        indexManager.releaseSearcher(INDEX, searcher);
      }
      if (ids.isEmpty()) {
        break;
      }
      for (String id : ids) {
        updateCitationCount(id, 0);
      }
      flush();
      reset += ids.size();
    }
    if (reset > 0) {
      log.info("Reset {} checked markers to 0", reset);
    }
    return reset;
  }

  private long currentCount(String documentId) throws IOException {
    IndexSearcher searcher = indexManager.acquireSearcher(INDEX);
    try {
      TopDocs hits = searcher.search(new TermQuery(new Term(PaperFields.ID, documentId)), 1);
      if (hits.scoreDocs.length == 0) {
        return Long.MIN_VALUE;
      }
      return LucenePaperIndex.citationCount(searcher, hits.scoreDocs[0].doc);
    } finally {
      indexManager.releaseSearcher(INDEX, searcher);
    }
  }

  private static Query arxivWithCount(long count) {
    return new BooleanQuery.Builder()
        .add(
            new TermQuery(new Term(PaperFields.SOURCE, PaperSource.ARXIV.getTag())),
            BooleanClause.Occur.FILTER)
        .add(
            NumericDocValuesField.newSlowExactQuery(PaperFields.CITATION_COUNT, count),
            BooleanClause.Occur.FILTER)
        .build();
  }
}
