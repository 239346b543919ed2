package com.dapapers.ingest_service.sources.semanticscholar;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.driver.CursorPage;
import com.dapapers.ingest_service.driver.CursorPageSource;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.PageItems;
import com.dapapers.ingest_service.sources.QueryUrl;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Graph API bulk search ({@code /paper/search/bulk}), up to 1000 papers per page, continued with
 * the {@code token} of the previous page. An empty cursor starts from the first page.
 */
@Component
public class S2BulkSearchCursorSource implements CursorPageSource<S2Paper> {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final IngestProperties ingestProperties;
  private final ObjectMapper objectMapper = Mappers.json();

  public S2BulkSearchCursorSource(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, IngestProperties ingestProperties) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.ingestProperties = ingestProperties;
  }

  @Override
  public String name() {
    return "s2-bulk-search";
  }

  @Override
  public CursorPage<S2Paper> fetchPage(String cursor) throws ApiFetchException {
    String url =
        QueryUrl.of(sourcesConfig.getS2GraphUrl() + "/paper/search/bulk")
            .param("query", ingestProperties.getS2().getBulkQuery())
            .param("fields", S2Fields.ALL)
            .param("token", cursor)
            .build();
    Map<String, String> headers =
        sourcesConfig.hasS2ApiKey()
            ? Map.of(S2Fields.API_KEY_HEADER, sourcesConfig.getS2ApiKey())
            : Map.of();
    JsonNode page = PageItems.readPage(objectMapper, httpClient.get(url, headers), name());
    PageItems.Bound<S2Paper> papers =
        PageItems.bind(objectMapper, page.path("data"), S2Paper.class, name());
    return new CursorPage<>(
        papers.items(),
        page.path("token").asText(null),
        page.path("total").asLong(0),
        papers.unreadable());
  }

  @Override
  public Optional<PaperRecord> convert(S2Paper item) {
    return S2PaperConverter.fromGraph(item);
  }
}
