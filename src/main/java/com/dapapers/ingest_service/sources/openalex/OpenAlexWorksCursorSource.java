package com.dapapers.ingest_service.sources.openalex;

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
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Cursor-paged export of OpenAlex works ({@code cursor=*} for the first page), filtered to the
 * arXiv repository and sorted by citations unless configured otherwise. Works that do not bind are
 * counted on the page and skipped.
 */
@Component
public class OpenAlexWorksCursorSource implements CursorPageSource<OpenAlexWork> {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final IngestProperties.OpenAlex settings;
  private final ObjectMapper objectMapper = Mappers.json();

  public OpenAlexWorksCursorSource(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, IngestProperties ingestProperties) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.settings = ingestProperties.getOpenalex();
  }

  @Override
  public String name() {
    return "openalex-works";
  }

  @Override
  public CursorPage<OpenAlexWork> fetchPage(String cursor) throws ApiFetchException {
    String url =
        QueryUrl.of(sourcesConfig.getOpenAlexBaseUrl() + "/works")
            .param("filter", settings.getFilter())
            .param("per_page", settings.getPerPage())
            .param("sort", settings.getSort())
            .param("select", settings.getSelect())
            .param("mailto", sourcesConfig.getOpenAlexMailto())
            .param("cursor", cursor == null || cursor.isBlank() ? "*" : cursor)
            .build();
    JsonNode page = PageItems.readPage(objectMapper, httpClient.get(url), name());
    JsonNode meta = page.path("meta");
    PageItems.Bound<OpenAlexWork> works =
        PageItems.bind(objectMapper, page.path("results"), OpenAlexWork.class, name());
    return new CursorPage<>(
        works.items(),
        meta.path("next_cursor").asText(null),
        meta.path("count").asLong(0),
        works.unreadable());
  }

  @Override
  public Optional<PaperRecord> convert(OpenAlexWork item) {
    return OpenAlexWorkConverter.fromArxivExport(item);
  }
}
