package com.dapapers.ingest_service.ids;

import static org.junit.jupiter.api.Assertions.*;

import com.dapapers.ingest_service.ids.DocumentIdResolver.ResolvedId;
import com.dapapers.ingest_service.model.PaperSource;
import org.junit.jupiter.api.Test;

class DocumentIdResolverTest {

  @Test
  void resolve_arxivIdPresent_sourceIsArxivAndNativeIdIsDocumentId() {
    ResolvedId id =
        DocumentIdResolver.resolve("13756489", "1706.03762v5", PaperSource.SEMANTIC_SCHOLAR, "x")
            .orElseThrow();

    assertEquals(new ResolvedId("13756489", "1706.03762", PaperSource.ARXIV), id);
  }

  @Test
  void resolve_noNativeId_externalIdIsDocumentId() {
    ResolvedId id =
        DocumentIdResolver.resolve(null, "1810.04805", PaperSource.SEMANTIC_SCHOLAR, null)
            .orElseThrow();

    assertEquals("1810.04805", id.documentId());
  }

  @Test
  void resolve_noArxiv_usesFallback() {
    ResolvedId id =
        DocumentIdResolver.resolve("42", "  ", PaperSource.PUBMED, "31452104").orElseThrow();

    assertEquals(new ResolvedId("42", "31452104", PaperSource.PUBMED), id);
  }

  @Test
  void resolve_nothingToIdentify_empty() {
    assertTrue(DocumentIdResolver.resolve("42", null, PaperSource.OPENALEX, " ").isEmpty());
  }

  @Test
  void resolve_sameInputTwice_sameIdentity() {
    assertEquals(
        DocumentIdResolver.resolve("7", "arXiv:2301.00001v2", PaperSource.ARXIV, null),
        DocumentIdResolver.resolve("7", "2301.00001", PaperSource.ARXIV, null));
  }
}
