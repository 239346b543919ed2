package com.dapapers.ingest_service.index;

import com.dapapers.ingest_service.analysis.AnalyzerManager;
import com.dapapers.ingest_service.analysis.AuthorNameAnalyzer;
import com.dapapers.ingest_service.analysis.PaperTextAnalyzer;
import com.dapapers.ingest_service.index.management.IndexContainer;
import com.dapapers.ingest_service.index.management.IndexManager;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.Mappers;
import java.nio.file.Path;

/** Real paper index wiring over a temporary directory. */
public final class LuceneTestIndex {

  public final IndexManager indexManager;
  public final LucenePaperIndex paperIndex;
  public final LuceneCitationStore citationStore;

  public LuceneTestIndex(Path baseDir) {
    AnalyzerManager analyzerManager =
        new AnalyzerManager(new PaperTextAnalyzer(), new AuthorNameAnalyzer());
    indexManager = new IndexManager(new IndexContainer(), analyzerManager);
    paperIndex =
        new LucenePaperIndex(
            indexManager,
            new LuceneIndexConfig(baseDir.toString()),
            new PaperDocumentFactory(Mappers.json()));
    citationStore = new LuceneCitationStore(indexManager);
  }

  public static PaperRecord arxivPaper(String arxivId, int citations) {
    return PaperRecord.builder()
        .id(arxivId)
        .externalId(arxivId)
        .source(PaperSource.ARXIV)
        .title("Paper " + arxivId)
        .citationCount(citations)
        .build();
  }

  public void close() {
    indexManager.closeAll();
  }
}
