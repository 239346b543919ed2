package com.dapapers.ingest_service.sources.arxiv;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.ids.ArxivIdExtractor;
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
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * arXiv Atom feed adapter.
 *
 * <p>The external id is the path segment after {@code /abs/} of the entry id, without version.
 * Entries without one are dropped.
 */
@Slf4j
@Component
public class ArxivFeedAdapter implements PaperSourceAdapter {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final XmlMapper xmlMapper = Mappers.xml();

  public ArxivFeedAdapter(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, RetryPolicies retryPolicies) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.search();
  }

  @Override
  public PaperSource source() {
    return PaperSource.ARXIV;
  }

  @Override
  public SearchResult search(String query, int limit, int offset) throws ApiFetchException {
    String url =
        QueryUrl.of(sourcesConfig.getArxivBaseUrl())
            .param("search_query", "all:" + Objects.requireNonNullElse(query, ""))
            .param("start", Math.max(0, offset))
            .param("max_results", PaperSourceAdapter.clampLimit(limit))
            .param("sortBy", "relevance")
            .param("sortOrder", "descending")
            .build();
    AtomFeed feed = fetchFeed(url);
    return new SearchResult(convert(feed), feed.getTotalResults());
  }

  @Override
  public Optional<PaperRecord> fetchById(String arxivId) throws ApiFetchException {
    String url =
        QueryUrl.of(sourcesConfig.getArxivBaseUrl()).param("id_list", arxivId).build();
    return convert(fetchFeed(url)).stream().findFirst();
  }

  private AtomFeed fetchFeed(String url) throws ApiFetchException {
    String body = retryPolicy.execute("arXiv query", () -> httpClient.get(url));
    return parse(body);
  }

  AtomFeed parse(String xml) {
    try {
      AtomFeed feed = xmlMapper.readValue(xml, AtomFeed.class);
      return feed == null ? new AtomFeed() : feed;
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse arXiv response", e);
    }
  }

  List<PaperRecord> convert(AtomFeed feed) {
    List<PaperRecord> papers = new ArrayList<>();
    for (AtomFeed.Entry entry : feed.getEntries()) {
      toPaper(entry).ifPresent(papers::add);
    }
    return papers;
  }

  Optional<PaperRecord> toPaper(AtomFeed.Entry entry) {
    Optional<String> arxivId = ArxivIdExtractor.fromAbsUrl(entry.getId());
    if (arxivId.isEmpty()) {
      log.debug("Dropping arXiv entry without abs id: {}", entry.getId());
      return Optional.empty();
    }
    String id = arxivId.get();

    List<Author> authors = new ArrayList<>();
    for (AtomFeed.AtomAuthor author : entry.getAuthors()) {
      String affiliation = author.getAffiliations().isEmpty() ? null : author.getAffiliations().get(0);
      authors.add(new Author(Texts.clean(author.getName()), affiliation));
    }

    String pdfUrl = Texts.arxivPdfUrl(id);
    for (AtomFeed.Link link : entry.getLinks()) {
      if ("pdf".equals(link.getTitle()) || "application/pdf".equals(link.getType())) {
        pdfUrl = link.getHref();
        break;
      }
    }

    List<String> categories = new ArrayList<>();
    if (entry.getPrimaryCategory() != null) {
      categories.add(entry.getPrimaryCategory().getTerm());
    }
    entry.getCategories().forEach(c -> categories.add(c.getTerm()));

    return Optional.of(
        PaperRecord.builder()
            .id(id)
            .externalId(id)
            .source(PaperSource.ARXIV)
            .title(Texts.clean(entry.getTitle()))
            .abstractText(Texts.clean(entry.getSummary()))
            .authors(authors)
            .publishedDate(parseRfc3339(entry.getPublished()))
            .pdfUrl(pdfUrl)
            .categories(categories)
            .doi(entry.getDoi())
            .journal(entry.getJournalRef())
            .openAccess(true)
            .sourceUrl("https://arxiv.org/abs/" + id)
            .htmlUrl("https://ar5iv.labs.arxiv.org/html/" + id)
            .build());
  }

  private static LocalDate parseRfc3339(String value) {
    if (!Texts.hasText(value)) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value.trim()).toLocalDate();
    } catch (DateTimeParseException e) {
      log.debug("Unparsable arXiv date {}", value);
      return null;
    }
  }
}
