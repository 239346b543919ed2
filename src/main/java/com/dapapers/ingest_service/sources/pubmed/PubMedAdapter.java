package com.dapapers.ingest_service.sources.pubmed;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.model.SearchResult;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.PaperSourceAdapter;
import com.dapapers.ingest_service.sources.QueryUrl;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.dapapers.ingest_service.sources.Texts;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * PubMed adapter over NCBI E-utilities: ESearch for a page of PMIDs and the hit count, then one
 * EFetch for all of them.
 */
@Slf4j
@Component
public class PubMedAdapter implements PaperSourceAdapter {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final XmlMapper xmlMapper = Mappers.xml();

  public PubMedAdapter(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, RetryPolicies retryPolicies) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.search();
  }

  @Override
  public PaperSource source() {
    return PaperSource.PUBMED;
  }

  @Override
  public SearchResult search(String query, int limit, int offset) throws ApiFetchException {
    String searchUrl =
        QueryUrl.of(sourcesConfig.getPubmedEsearchUrl())
            .param("db", "pubmed")
            .param("term", query)
            .param("retstart", Math.max(0, offset))
            .param("retmax", PaperSourceAdapter.clampLimit(limit))
            .param("sort", "relevance")
            .param("retmode", "xml")
            .build();
    String body = retryPolicy.execute("PubMed esearch", () -> httpClient.get(searchUrl));
    ESearchResult searchResult = read(body, ESearchResult.class, "esearch");
    List<String> ids = searchResult.getIds() == null ? List.of() : searchResult.getIds();
    if (ids.isEmpty()) {
      return SearchResult.empty(searchResult.getCount());
    }
    return new SearchResult(fetchArticles(ids), searchResult.getCount());
  }

  @Override
  public Optional<PaperRecord> fetchById(String pmid) throws ApiFetchException {
    return fetchArticles(List.of(pmid)).stream().findFirst();
  }

  List<PaperRecord> fetchArticles(List<String> pmids) throws ApiFetchException {
    String fetchUrl =
        QueryUrl.of(sourcesConfig.getPubmedEfetchUrl())
            .param("db", "pubmed")
            .param("id", String.join(",", pmids))
            .param("retmode", "xml")
            .param("rettype", "abstract")
            .build();
    String body = retryPolicy.execute("PubMed efetch", () -> httpClient.get(fetchUrl));
    PubmedArticleSet articleSet = read(body, PubmedArticleSet.class, "efetch");
    List<PaperRecord> papers = new ArrayList<>();
    if (articleSet.getArticles() != null) {
      for (PubmedArticleSet.PubmedArticle article : articleSet.getArticles()) {
        toPaper(article).ifPresent(papers::add);
      }
    }
    return papers;
  }

  private <T> T read(String xml, Class<T> type, String step) {
    try {
      T value = xmlMapper.readValue(xml, type);
      if (value == null) {
        throw new SourceParseException("Empty PubMed " + step + " response");
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse PubMed " + step + " response", e);
    }
  }

  Optional<PaperRecord> toPaper(PubmedArticleSet.PubmedArticle article) {
    PubmedArticleSet.MedlineCitation citation = article.getMedlineCitation();
    if (citation == null || citation.getPmid() == null || !Texts.hasText(citation.getPmid().getValue())) {
      return Optional.empty();
    }
    String pmid = citation.getPmid().getValue().trim();
    PubmedArticleSet.Article details =
        citation.getArticle() == null ? new PubmedArticleSet.Article() : citation.getArticle();

    String doi = null;
    String pmcId = null;
    if (article.getPubmedData() != null && article.getPubmedData().getArticleIds() != null) {
      for (PubmedArticleSet.ArticleId id : article.getPubmedData().getArticleIds()) {
        if ("doi".equalsIgnoreCase(id.getIdType()) && Texts.hasText(id.getValue())) {
          doi = id.getValue().trim();
        } else if ("pmc".equalsIgnoreCase(id.getIdType()) && Texts.hasText(id.getValue())) {
          pmcId = id.getValue().trim();
        }
      }
    }

    String pdfUrl = null;
    String htmlUrl = null;
    if (pmcId != null) {
      pdfUrl = Texts.pmcArticleUrl(pmcId) + "pdf/";
      htmlUrl = Texts.pmcArticleUrl(pmcId);
    } else if (doi != null) {
      pdfUrl = Texts.doiUrl(doi);
    }

    PubmedArticleSet.Journal journal = details.getJournal();
    LocalDate published =
        journal == null || journal.getJournalIssue() == null
            ? null
            : PubDateParser.parse(journal.getJournalIssue().getPubDate());

    return Optional.of(
        PaperRecord.builder()
            .id(pmid)
            .externalId(pmid)
            .source(PaperSource.PUBMED)
            .title(Texts.clean(details.getArticleTitle()))
            .abstractText(renderAbstract(details.getAbstractSection()))
            .authors(authors(details.getAuthors()))
            .publishedDate(published)
            .pdfUrl(pdfUrl)
            .doi(doi)
            .journal(journal == null ? null : journal.getTitle())
            .publicationTypes(publicationTypes(details.getPublicationTypes()))
            .openAccess(pmcId != null)
            .sourceUrl("https://pubmed.ncbi.nlm.nih.gov/" + pmid + "/")
            .htmlUrl(htmlUrl)
            .pmcId(pmcId)
            .build());
  }

  /** Labeled sections become {@code "Label: text"}; sections are separated by a blank line. */
  static String renderAbstract(PubmedArticleSet.Abstract section) {
    if (section == null || section.getTexts() == null) {
      return "";
    }
    return section.getTexts().stream()
        .filter(t -> t != null && Texts.hasText(t.getText()))
        .map(
            t ->
                Texts.hasText(t.getLabel())
                    ? t.getLabel().trim() + ": " + t.getText().trim()
                    : t.getText().trim())
        .collect(Collectors.joining("\n\n"));
  }

  private static List<Author> authors(List<PubmedArticleSet.PubmedAuthor> authors) {
    List<Author> result = new ArrayList<>();
    if (authors == null) {
      return result;
    }
    for (PubmedArticleSet.PubmedAuthor author : authors) {
      String name =
          Texts.hasText(author.getCollectiveName())
              ? author.getCollectiveName()
              : (Texts.clean(author.getForeName()) + " " + Texts.clean(author.getLastName()));
      String affiliation =
          author.getAffiliationInfo() == null || author.getAffiliationInfo().isEmpty()
              ? null
              : author.getAffiliationInfo().get(0).getAffiliation();
      Author converted = new Author(name, affiliation);
      if (!converted.name().isEmpty()) {
        result.add(converted);
      }
    }
    return result;
  }

  private static List<String> publicationTypes(List<PubmedArticleSet.TextValue> types) {
    if (types == null) {
      return List.of();
    }
    return types.stream()
        .filter(t -> t != null && Texts.hasText(t.getValue()))
        .map(t -> t.getValue().trim())
        .toList();
  }
}
