package com.dapapers.ingest_service.sources.openalex;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.model.SearchResult;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.PaperSourceAdapter;
import com.dapapers.ingest_service.sources.QueryUrl;
import com.dapapers.ingest_service.sources.SortMode;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.http.HttpStatus;
import org.springframework.stereotype.Component;

/** OpenAlex {@code /works} relevance search, page based. */
@Component
public class OpenAlexSearchAdapter implements PaperSourceAdapter {

  /** OpenAlex source id of arXiv as primary location. */
  static final String ARXIV_PRIMARY_SOURCE = "S4306400806";

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final ObjectMapper objectMapper = Mappers.json();

  public OpenAlexSearchAdapter(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, RetryPolicies retryPolicies) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.search();
  }

  @Override
  public PaperSource source() {
    return PaperSource.OPENALEX;
  }

  @Override
  public SearchResult search(String query, int limit, int offset) throws ApiFetchException {
    return search(query, limit, offset, SortMode.RELEVANCE, false);
  }

  /**
   * @param offset converted to a 1-based page of {@code limit} works
   * @param arxivOnly restrict to works whose primary location is arXiv
   */
  public SearchResult search(
      String query, int limit, int offset, SortMode sortMode, boolean arxivOnly)
      throws ApiFetchException {
    int perPage = PaperSourceAdapter.clampLimit(limit);
    int page = Math.max(0, offset) / perPage + 1;
    QueryUrl url =
        QueryUrl.of(sourcesConfig.getOpenAlexBaseUrl() + "/works")
            .param("search", query)
            .param("per_page", perPage)
            .param("page", page)
            .param("sort", sortParam(sortMode))
            .param("filter", arxivOnly ? "primary_location.source.id:" + ARXIV_PRIMARY_SOURCE : null)
            .param("mailto", sourcesConfig.getOpenAlexMailto());
    String requestUrl = url.build();
    OpenAlexWorksPage response =
        read(retryPolicy.execute("OpenAlex search", () -> httpClient.get(requestUrl)),
            OpenAlexWorksPage.class);
    List<PaperRecord> papers = new ArrayList<>();
    response.getResults().forEach(w -> OpenAlexWorkConverter.fromSearch(w).ifPresent(papers::add));
    return new SearchResult(papers, response.getMeta().getCount());
  }

  /** Looks up a work by OpenAlex id ({@code W...}) or by {@code doi:<doi>}. */
  @Override
  public Optional<PaperRecord> fetchById(String id) throws ApiFetchException {
    String requestUrl =
        QueryUrl.of(sourcesConfig.getOpenAlexBaseUrl() + "/works/" + id)
            .param("mailto", sourcesConfig.getOpenAlexMailto())
            .build();
    try {
      String body = retryPolicy.execute("OpenAlex work lookup", () -> httpClient.get(requestUrl));
      return OpenAlexWorkConverter.fromSearch(read(body, OpenAlexWork.class));
    } catch (ApiFetchException e) {
      if (e.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        return Optional.empty();
      }
      throw e;
    }
  }

  static String sortParam(SortMode sortMode) {
    if (sortMode == SortMode.CITATION_COUNT) {
      return "cited_by_count:desc";
    }
    if (sortMode == SortMode.PUBLICATION_DATE) {
      return "publication_date:desc";
    }
    return null;
  }

  private <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse OpenAlex response", e);
    }
  }
}
