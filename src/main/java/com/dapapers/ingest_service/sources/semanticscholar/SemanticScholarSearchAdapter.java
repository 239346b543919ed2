package com.dapapers.ingest_service.sources.semanticscholar;

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
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpStatus;
import org.springframework.stereotype.Component;

/** Semantic Scholar Graph API relevance search. */
@Slf4j
@Component
public class SemanticScholarSearchAdapter implements PaperSourceAdapter {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final ObjectMapper objectMapper = Mappers.json();

  public SemanticScholarSearchAdapter(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, RetryPolicies retryPolicies) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.search();
  }

  @Override
  public PaperSource source() {
    return PaperSource.SEMANTIC_SCHOLAR;
  }

  @Override
  public SearchResult search(String query, int limit, int offset) throws ApiFetchException {
    return search(query, limit, offset, SortMode.RELEVANCE);
  }

  public SearchResult search(String query, int limit, int offset, SortMode sortMode)
      throws ApiFetchException {
    QueryUrl url =
        QueryUrl.of(sourcesConfig.getS2GraphUrl() + "/paper/search")
            .param("query", query)
            .param("offset", Math.max(0, offset))
            .param("limit", PaperSourceAdapter.clampLimit(limit))
            .param("fields", S2Fields.SEARCH)
            .param("sort", sortParam(sortMode));
    String requestUrl = url.build();
    String body =
        retryPolicy.execute("S2 search", () -> httpClient.get(requestUrl, headers()));
    S2SearchResponse response = read(body, S2SearchResponse.class);
    List<PaperRecord> papers = new ArrayList<>();
    if (response.getData() != null) {
      response.getData().forEach(p -> S2PaperConverter.fromGraph(p).ifPresent(papers::add));
    }
    return new SearchResult(papers, response.getTotal());
  }

  /**
   * Looks up a paper by any id the Graph API accepts: S2 paper id, {@code ARXIV:<id>}, {@code
   * DOI:<doi>}, {@code PMID:<id>}, {@code CorpusId:<id>}.
   */
  @Override
  public Optional<PaperRecord> fetchById(String id) throws ApiFetchException {
    String requestUrl =
        QueryUrl.of(
                sourcesConfig.getS2GraphUrl()
                    + "/paper/"
                    + URLEncoder.encode(id, StandardCharsets.UTF_8))
            .param("fields", S2Fields.ALL)
            .build();
    try {
      String body =
          retryPolicy.execute("S2 paper lookup", () -> httpClient.get(requestUrl, headers()));
      return S2PaperConverter.fromGraph(read(body, S2Paper.class));
    } catch (ApiFetchException e) {
      if (e.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        return Optional.empty();
      }
      throw e;
    }
  }

  static String sortParam(SortMode sortMode) {
    if (sortMode == null) {
      return null;
    }
    switch (sortMode) {
      case CITATION_COUNT:
        return "citationCount:desc";
      case PUBLICATION_DATE:
        return "publicationDate:desc";
      default:
        return null;
    }
  }

  private Map<String, String> headers() {
    return sourcesConfig.hasS2ApiKey()
        ? Map.of(S2Fields.API_KEY_HEADER, sourcesConfig.getS2ApiKey())
        : Map.of();
  }

  private <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse Semantic Scholar response", e);
    }
  }
}
