package com.dapapers.ingest_service.ids;

import com.dapapers.ingest_service.model.PaperSource;
import java.util.Optional;

/**
 * Derives the document id, external id and source tag of a record.
 *
 * <p>The document id is the registry-native id when the upstream has one (Semantic Scholar corpus
 * id, OpenAlex work number), else the arXiv id, else the fallback external id. The source is
 * {@link PaperSource#ARXIV} whenever an arXiv id was resolved, with the arXiv id as external id.
 * Re-importing the same upstream record always produces the same document id.
 */
public final class DocumentIdResolver {

  private DocumentIdResolver() {}

  /**
   * @param nativeId registry-native id, may be null
   * @param arxivId arXiv id, may be null; normalized before use
   * @param fallbackSource source tag used when no arXiv id is known
   * @param fallbackExternalId external id used when no arXiv id is known, may be null
   * @return the resolved identity, or empty when no external id can be found
   */
  public static Optional<ResolvedId> resolve(
      String nativeId, String arxivId, PaperSource fallbackSource, String fallbackExternalId) {
    String arxiv = ArxivIdExtractor.normalize(arxivId);
    String fallback = fallbackExternalId == null ? "" : fallbackExternalId.trim();

    String externalId;
    PaperSource source;
    if (!arxiv.isEmpty()) {
      externalId = arxiv;
      source = PaperSource.ARXIV;
    } else if (!fallback.isEmpty()) {
      externalId = fallback;
      source = fallbackSource;
    } else {
      return Optional.empty();
    }

    String documentId;
    if (nativeId != null && !nativeId.isBlank()) {
      documentId = nativeId.trim();
    } else {
      documentId = externalId;
    }
    return Optional.of(new ResolvedId(documentId, externalId, source));
  }

  /** Identity triple of a record. */
  public record ResolvedId(String documentId, String externalId, PaperSource source) {}
}
