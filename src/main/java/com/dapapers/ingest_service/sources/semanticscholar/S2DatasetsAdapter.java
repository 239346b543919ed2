package com.dapapers.ingest_service.sources.semanticscholar;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.RetryPolicy;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.model.SearchResult;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.PaperSourceAdapter;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.dapapers.ingest_service.sources.Texts;
import com.dapapers.ingest_service.streaming.BatchCallback;
import com.dapapers.ingest_service.streaming.DecodeResult;
import com.dapapers.ingest_service.streaming.StreamingBatchDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Semantic Scholar bulk datasets: release manifest plus streaming of the gzip JSON Lines files.
 *
 * <p>Every datasets call needs an API key. The file URLs in the manifest are pre-signed and are
 * fetched without it.
 */
@Slf4j
@Component
public class S2DatasetsAdapter implements PaperSourceAdapter {

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final RetryPolicy retryPolicy;
  private final StreamingBatchDecoder decoder;
  private final boolean arxivOnly;
  private final ObjectMapper objectMapper = Mappers.json();
  private final ObjectReader paperReader = objectMapper.readerFor(S2Paper.class);

  public S2DatasetsAdapter(
      ApiHttpClient httpClient,
      SourcesConfig sourcesConfig,
      RetryPolicies retryPolicies,
      IngestProperties ingestProperties) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.retryPolicy = retryPolicies.paging();
    this.decoder =
        new StreamingBatchDecoder(
            ingestProperties.getMaxLineBytes(), ingestProperties.getDecoderProgressEvery());
    this.arxivOnly = ingestProperties.getS2().isArxivOnly();
  }

  @Override
  public PaperSource source() {
    return PaperSource.SEMANTIC_SCHOLAR;
  }

  @Override
  public SearchResult search(String query, int limit, int offset) {
    throw new UnsupportedOperationException("Bulk datasets cannot be searched");
  }

  @Override
  public Optional<PaperRecord> fetchById(String id) {
    throw new UnsupportedOperationException("Bulk datasets have no per-paper lookup");
  }

  /** Id of the most recent dataset release, e.g. {@code 2024-06-18}. */
  public String latestRelease() throws ApiFetchException {
    String url = sourcesConfig.getS2DatasetsUrl() + "/release/latest";
    JsonNode root = readTree(retryPolicy.execute("S2 latest release", () -> get(url)));
    String releaseId = root.path("release_id").asText("");
    if (releaseId.isEmpty()) {
      throw new SourceParseException("No release_id in " + url);
    }
    return releaseId;
  }

  /** Download URLs of the files of dataset {@code name} in release {@code releaseId}. */
  public List<String> datasetFiles(String releaseId, String name) throws ApiFetchException {
    String url = sourcesConfig.getS2DatasetsUrl() + "/release/" + releaseId + "/dataset/" + name;
    JsonNode root = readTree(retryPolicy.execute("S2 dataset manifest", () -> get(url)));
    List<String> files = new ArrayList<>();
    root.path("files").forEach(node -> files.add(node.asText()));
    log.info("Dataset {} of release {} has {} files", name, releaseId, files.size());
    return files;
  }

  /** Files of the configured dataset in the latest release. */
  public List<String> latestDatasetFiles() throws ApiFetchException {
    return datasetFiles(latestRelease(), sourcesConfig.getS2DatasetName());
  }

  /**
   * Streams one dataset file through the decoder. Failures while reading are reported in the
   * returned {@link DecodeResult}.
   *
   * @throws ApiFetchException if the download cannot be started
   */
  public DecodeResult streamFile(
      String fileUrl, int batchSize, Predicate<S2Paper> filter, BatchCallback<S2Paper> callback)
      throws ApiFetchException {
    return httpClient.stream(
        fileUrl,
        Map.of(),
        body -> decoder.decode(body, paperReader, S2Paper.class, batchSize, filter, callback),
        DecodeResult::isComplete);
  }

  /** Keeps titled papers and, when the import is arXiv-only, papers carrying an arXiv id. */
  public Predicate<S2Paper> defaultFilter() {
    return defaultFilter(arxivOnly);
  }

  static Predicate<S2Paper> defaultFilter(boolean arxivOnly) {
    return paper ->
        Texts.hasText(paper.getTitle())
            && (!arxivOnly || paper.externalIdsOrEmpty().arxiv().isPresent());
  }

  private String get(String url) throws ApiFetchException {
    requireApiKey();
    return httpClient.get(url, Map.of(S2Fields.API_KEY_HEADER, sourcesConfig.getS2ApiKey()));
  }

  private void requireApiKey() {
    if (!sourcesConfig.hasS2ApiKey()) {
      throw new IllegalStateException(
          "s2.api-key is required to access the Semantic Scholar datasets API");
    }
  }

  private JsonNode readTree(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse Semantic Scholar datasets response", e);
    }
  }
}
