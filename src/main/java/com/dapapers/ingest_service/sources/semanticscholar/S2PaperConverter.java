package com.dapapers.ingest_service.sources.semanticscholar;

import com.dapapers.ingest_service.ids.DocumentIdResolver;
import com.dapapers.ingest_service.ids.DoiNormalizer;
import com.dapapers.ingest_service.ids.DocumentIdResolver.ResolvedId;
import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.ExternalIds;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.Texts;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps {@link S2Paper}s to canonical records.
 *
 * <p>Search results resolve their identity as arXiv id, then PubMed id, then DOI, then the S2
 * paper id. Dataset records resolve it as arXiv id, then corpus id. In both cases the corpus id,
 * when present, is the document id.
 */
public final class S2PaperConverter {

  private S2PaperConverter() {}

  /** Converts a Graph API search or lookup result. */
  public static Optional<PaperRecord> fromGraph(S2Paper paper) {
    if (paper == null || !Texts.hasText(paper.getTitle())) {
      return Optional.empty();
    }
    ExternalIds ids = paper.externalIdsOrEmpty();
    PaperSource fallbackSource = PaperSource.SEMANTIC_SCHOLAR;
    String fallbackId;
    if (ids.pubmed().isPresent()) {
      fallbackSource = PaperSource.PUBMED;
      fallbackId = ids.pubmed().get();
    } else if (ids.doi().isPresent()) {
      fallbackId = DoiNormalizer.normalize(ids.doi().get());
    } else {
      fallbackId = paper.getPaperId();
    }
    return DocumentIdResolver.resolve(
            corpusId(paper), ids.arxiv().orElse(null), fallbackSource, fallbackId)
        .map(resolved -> build(paper, resolved));
  }

  /** Converts one line of the bulk {@code papers} dataset. */
  public static Optional<PaperRecord> fromDataset(S2Paper paper) {
    if (paper == null || !Texts.hasText(paper.getTitle())) {
      return Optional.empty();
    }
    String corpusId = corpusId(paper);
    return DocumentIdResolver.resolve(
            corpusId,
            paper.externalIdsOrEmpty().arxiv().orElse(null),
            PaperSource.SEMANTIC_SCHOLAR,
            corpusId)
        .map(resolved -> build(paper, resolved));
  }

  private static PaperRecord build(S2Paper paper, ResolvedId resolved) {
    ExternalIds ids = paper.externalIdsOrEmpty();
    String arxivId = resolved.source() == PaperSource.ARXIV ? resolved.externalId() : null;
    String doi = ids.doi().map(DoiNormalizer::normalize).orElse(null);
    String pmcId = ids.pmcid().map(Texts::pmcId).orElse(null);

    String pdfUrl = null;
    if (paper.getOpenAccessPdf() != null && Texts.hasText(paper.getOpenAccessPdf().getUrl())) {
      pdfUrl = paper.getOpenAccessPdf().getUrl();
    } else if (arxivId != null) {
      pdfUrl = Texts.arxivPdfUrl(arxivId);
    } else if (doi != null) {
      pdfUrl = Texts.doiUrl(doi);
    }

    String htmlUrl = null;
    if (pmcId != null) {
      htmlUrl = Texts.pmcArticleUrl(pmcId);
    } else if (arxivId != null) {
      htmlUrl = "https://arxiv.org/html/" + arxivId;
    }

    return PaperRecord.builder()
        .id(resolved.documentId())
        .externalId(resolved.externalId())
        .source(resolved.source())
        .title(Texts.clean(paper.getTitle()))
        .abstractText(paper.getAbstractText())
        .authors(authors(paper.getAuthors()))
        .publishedDate(Texts.parseIsoDate(paper.getPublicationDate(), paper.getYear()))
        .year(paper.getYear())
        .pdfUrl(pdfUrl)
        .categories(categories(paper))
        .doi(doi)
        .journal(paper.getJournal() == null ? null : paper.getJournal().getName())
        .venue(paper.getVenue())
        .citationCount(orZero(paper.getCitationCount()))
        .referenceCount(orZero(paper.getReferenceCount()))
        .influentialCitationCount(orZero(paper.getInfluentialCitationCount()))
        .openAccess(Boolean.TRUE.equals(paper.getIsOpenAccess()))
        .publicationTypes(paper.getPublicationTypes())
        .sourceUrl(paper.getUrl())
        .htmlUrl(htmlUrl)
        .pmcId(pmcId)
        .tldr(paper.getTldr() == null ? null : paper.getTldr().getText())
        .build();
  }

  private static String corpusId(S2Paper paper) {
    if (paper.getCorpusId() != null) {
      return paper.getCorpusId().toString();
    }
    return paper.externalIdsOrEmpty().corpusId().orElse(null);
  }

  private static List<String> categories(S2Paper paper) {
    List<String> categories = new ArrayList<>();
    if (paper.getS2FieldsOfStudy() != null) {
      paper.getS2FieldsOfStudy().stream()
          .filter(Objects::nonNull)
          .map(S2Paper.FieldOfStudy::getCategory)
          .forEach(categories::add);
    }
    if (categories.isEmpty() && paper.getFieldsOfStudy() != null) {
      categories.addAll(paper.getFieldsOfStudy());
    }
    return categories;
  }

  private static List<Author> authors(List<S2Paper.S2Author> authors) {
    if (authors == null) {
      return List.of();
    }
    return authors.stream()
        .filter(a -> a != null && Texts.hasText(a.getName()))
        .map(a -> new Author(a.getName(), null, a.getAuthorId()))
        .toList();
  }

  private static int orZero(Integer value) {
    return value == null ? 0 : value;
  }
}
