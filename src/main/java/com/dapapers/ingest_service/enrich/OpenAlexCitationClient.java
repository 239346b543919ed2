package com.dapapers.ingest_service.enrich;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.ids.ArxivIdExtractor;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.QueryUrl;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks up citation counts on OpenAlex through the arXiv DataCite DOIs ({@code
 * 10.48550/arXiv.<id>}), all ids of a batch in one {@code doi:} filter.
 */
@Slf4j
@Component
public class OpenAlexCitationClient implements CitationLookupClient {

  private static final String ARXIV_DOI_PREFIX = "10.48550/arXiv.";

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final ObjectMapper objectMapper = Mappers.json();

  public OpenAlexCitationClient(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, RetryPolicies retryPolicies) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.lookup();
  }

  @Override
  public Map<String, Integer> lookup(List<String> arxivIds) throws ApiFetchException {
    if (arxivIds == null || arxivIds.isEmpty()) {
      return Map.of();
    }
    if (arxivIds.size() > MAX_IDS) {
      throw new IllegalArgumentException(
          "At most " + MAX_IDS + " ids per lookup, got " + arxivIds.size());
    }
    String filter =
        arxivIds.stream().map(id -> ARXIV_DOI_PREFIX + id).collect(Collectors.joining("|"));
    String url =
        QueryUrl.of(sourcesConfig.getOpenAlexBaseUrl() + "/works")
            .param("filter", "doi:" + filter)
            .param("select", "doi,cited_by_count")
            .param("per_page", arxivIds.size())
            .param("mailto", sourcesConfig.getOpenAlexMailto())
            .build();
    String body = retryPolicy.execute("OpenAlex citation lookup", () -> httpClient.get(url));
    return parse(body);
  }

  /** Maps each returned work back to its arXiv id through the DOI. */
  Map<String, Integer> parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse OpenAlex citation response", e);
    }
    Map<String, Integer> counts = new HashMap<>();
    for (JsonNode work : root.path("results")) {
      Optional<String> arxivId = ArxivIdExtractor.fromDoi(work.path("doi").asText(null));
      if (arxivId.isEmpty()) {
        log.debug("Ignoring work without arXiv DOI: {}", work.path("doi").asText());
        continue;
      }
      counts.put(ArxivIdExtractor.normalize(arxivId.get()), work.path("cited_by_count").asInt(0));
    }
    return counts;
  }
}
