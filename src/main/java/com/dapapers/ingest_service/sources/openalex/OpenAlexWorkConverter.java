package com.dapapers.ingest_service.sources.openalex;

import com.dapapers.ingest_service.ids.AbstractReconstructor;
import com.dapapers.ingest_service.ids.ArxivIdExtractor;
import com.dapapers.ingest_service.ids.DoiNormalizer;
import com.dapapers.ingest_service.ids.DocumentIdResolver;
import com.dapapers.ingest_service.ids.DocumentIdResolver.ResolvedId;
import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.Texts;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps {@link OpenAlexWork}s to canonical records. The work number ({@code W} stripped) is the
 * document id in both modes.
 */
public final class OpenAlexWorkConverter {

  private static final String PUBMED_PREFIX = "https://pubmed.ncbi.nlm.nih.gov/";
  private static final String PMC_PREFIX = "https://www.ncbi.nlm.nih.gov/pmc/articles/";

  private OpenAlexWorkConverter() {}

  /**
   * Conversion for the arXiv works export: works without an arXiv id are dropped. The PDF link
   * is taken from the location the id was found in, else built from the id.
   */
  public static Optional<PaperRecord> fromArxivExport(OpenAlexWork work) {
    if (work == null || !Texts.hasText(work.getTitle())) {
      return Optional.empty();
    }
    String arxivId = null;
    String pdfUrl = null;
    for (OpenAlexWork.Location location : locations(work)) {
      Optional<String> id = ArxivIdExtractor.fromLocationUrl(location.getLandingPageUrl());
      if (id.isPresent()) {
        arxivId = id.get();
        pdfUrl = location.getPdfUrl();
        break;
      }
    }
    if (arxivId == null) {
      arxivId = ArxivIdExtractor.extract(landingPages(work), work.getDoi()).orElse(null);
    }
    if (arxivId == null) {
      return Optional.empty();
    }
    Optional<ResolvedId> resolved =
        DocumentIdResolver.resolve(work.workNumber(), arxivId, PaperSource.ARXIV, null);
    if (resolved.isEmpty()) {
      return Optional.empty();
    }
    String externalId = resolved.get().externalId();
    if (!Texts.hasText(pdfUrl)) {
      pdfUrl = Texts.arxivPdfUrl(externalId);
    }
    return Optional.of(
        base(work, resolved.get())
            .title(Texts.clean(work.getTitle()))
            .pdfUrl(pdfUrl)
            .venue(firstNonArxivVenue(work))
            .htmlUrl("https://arxiv.org/html/" + externalId)
            .build());
  }

  /**
   * Conversion for relevance search: identity is the arXiv id, else the PubMed id, else the
   * OpenAlex work id.
   */
  public static Optional<PaperRecord> fromSearch(OpenAlexWork work) {
    if (work == null) {
      return Optional.empty();
    }
    String title = Texts.hasText(work.getTitle()) ? work.getTitle() : work.getDisplayName();
    if (!Texts.hasText(title)) {
      return Optional.empty();
    }
    String arxivId = ArxivIdExtractor.extract(landingPages(work), work.getDoi()).orElse(null);
    String pmid = stripIdUrl(work, "pmid", PUBMED_PREFIX);
    PaperSource fallbackSource = pmid != null ? PaperSource.PUBMED : PaperSource.OPENALEX;
    String fallbackId = pmid != null ? pmid : work.shortId();
    Optional<ResolvedId> resolved =
        DocumentIdResolver.resolve(work.workNumber(), arxivId, fallbackSource, fallbackId);
    if (resolved.isEmpty()) {
      return Optional.empty();
    }
    String resolvedArxiv =
        resolved.get().source() == PaperSource.ARXIV ? resolved.get().externalId() : null;
    String pmcId = Texts.pmcId(stripIdUrl(work, "pmcid", PMC_PREFIX));

    OpenAlexWork.Location primary = work.getPrimaryLocation();
    String pdfUrl = null;
    if (primary != null && Texts.hasText(primary.getPdfUrl())) {
      pdfUrl = primary.getPdfUrl();
    } else if (work.getOpenAccess() != null && Texts.hasText(work.getOpenAccess().getOaUrl())) {
      pdfUrl = work.getOpenAccess().getOaUrl();
    } else if (resolvedArxiv != null) {
      pdfUrl = Texts.arxivPdfUrl(resolvedArxiv);
    } else if (DoiNormalizer.normalize(work.getDoi()) != null) {
      pdfUrl = Texts.doiUrl(work.getDoi());
    }

    String htmlUrl = null;
    if (pmcId != null) {
      htmlUrl = Texts.pmcArticleUrl(pmcId);
    } else if (resolvedArxiv != null) {
      htmlUrl = "https://arxiv.org/html/" + resolvedArxiv;
    }

    String venue =
        primary != null && primary.getSource() != null
            ? primary.getSource().getDisplayName()
            : null;

    return Optional.of(
        base(work, resolved.get())
            .title(Texts.clean(title))
            .pdfUrl(pdfUrl)
            .venue(venue)
            .htmlUrl(htmlUrl)
            .pmcId(pmcId)
            .build());
  }

  private static PaperRecord.PaperRecordBuilder base(OpenAlexWork work, ResolvedId resolved) {
    return PaperRecord.builder()
        .id(resolved.documentId())
        .externalId(resolved.externalId())
        .source(resolved.source())
        .abstractText(AbstractReconstructor.reconstruct(work.getAbstractInvertedIndex()))
        .authors(authors(work))
        .publishedDate(Texts.parseIsoDate(work.getPublicationDate(), work.getPublicationYear()))
        .year(work.getPublicationYear())
        .categories(topicFields(work))
        .doi(work.getDoi())
        .citationCount(work.getCitedByCount() == null ? 0 : work.getCitedByCount())
        .openAccess(work.getOpenAccess() != null && Boolean.TRUE.equals(work.getOpenAccess().getIsOa()))
        .publicationTypes(work.getType() == null ? List.of() : List.of(work.getType()))
        .sourceUrl(work.getId());
  }

  private static List<OpenAlexWork.Location> locations(OpenAlexWork work) {
    return work.getLocations() == null ? List.of() : work.getLocations();
  }

  private static List<String> landingPages(OpenAlexWork work) {
    List<String> urls = new ArrayList<>();
    if (work.getPrimaryLocation() != null) {
      urls.add(work.getPrimaryLocation().getLandingPageUrl());
    }
    for (OpenAlexWork.Location location : locations(work)) {
      urls.add(location.getLandingPageUrl());
    }
    return urls;
  }

  private static String firstNonArxivVenue(OpenAlexWork work) {
    for (OpenAlexWork.Location location : locations(work)) {
      if (location.getSource() == null) {
        continue;
      }
      String name = location.getSource().getDisplayName();
      if (Texts.hasText(name) && !name.toLowerCase(Locale.ROOT).contains("arxiv")) {
        return name;
      }
    }
    return null;
  }

  private static List<String> topicFields(OpenAlexWork work) {
    List<String> fields = new ArrayList<>();
    if (work.getTopics() == null) {
      return fields;
    }
    for (OpenAlexWork.Topic topic : work.getTopics()) {
      if (topic.getField() != null) {
        fields.add(topic.getField().getDisplayName());
      }
    }
    return fields;
  }

  private static List<Author> authors(OpenAlexWork work) {
    List<Author> authors = new ArrayList<>();
    if (work.getAuthorships() == null) {
      return authors;
    }
    for (OpenAlexWork.Authorship authorship : work.getAuthorships()) {
      if (authorship.getAuthor() == null || !Texts.hasText(authorship.getAuthor().getDisplayName())) {
        continue;
      }
      String affiliation = null;
      if (authorship.getInstitutions() != null && !authorship.getInstitutions().isEmpty()) {
        affiliation = authorship.getInstitutions().get(0).getDisplayName();
      }
      authors.add(
          new Author(
              authorship.getAuthor().getDisplayName(), affiliation, authorship.getAuthor().getId()));
    }
    return authors;
  }

  private static String stripIdUrl(OpenAlexWork work, String key, String prefix) {
    if (work.getIds() == null || !(work.getIds().get(key) instanceof String value)) {
      return null;
    }
    String id = value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    while (id.endsWith("/")) {
      id = id.substring(0, id.length() - 1);
    }
    return id.isBlank() ? null : id;
  }
}
