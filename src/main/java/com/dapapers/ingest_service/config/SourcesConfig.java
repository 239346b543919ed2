package com.dapapers.ingest_service.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Endpoints and credentials of the bibliographic sources.
 *
 * <p>This is a facade over the {@code sources.*}, {@code s2.*} and {@code openalex.*} properties.
 */
@Getter
@Component
public class SourcesConfig {

  private final String arxivBaseUrl;
  private final String arxivOaiUrl;
  private final String pubmedEsearchUrl;
  private final String pubmedEfetchUrl;
  private final String s2GraphUrl;
  private final String s2DatasetsUrl;
  private final String s2ApiKey;
  private final String s2DatasetName;
  private final String openAlexBaseUrl;
  private final String openAlexMailto;

  public SourcesConfig(
      @Value("${sources.arxiv.base-url:http://export.arxiv.org/api/query}") String arxivBaseUrl,
      @Value("${sources.pubmed.esearch-url:https://eutils.ncbi.nlm.nih.gov/entrez/eutils/esearch.fcgi}")
          String pubmedEsearchUrl,
      @Value("${sources.pubmed.efetch-url:https://eutils.ncbi.nlm.nih.gov/entrez/eutils/efetch.fcgi}")
          String pubmedEfetchUrl,
      @Value("${sources.s2.graph-url:https://api.semanticscholar.org/graph/v1}") String s2GraphUrl,
      @Value("${sources.s2.datasets-url:https://api.semanticscholar.org/datasets/v1}")
          String s2DatasetsUrl,
      @Value("${s2.api-key:}") String s2ApiKey,
      @Value("${s2.dataset-name:papers}") String s2DatasetName,
      @Value("${sources.openalex.base-url:https://api.openalex.org}") String openAlexBaseUrl,
      @Value("${openalex.mailto:}") String openAlexMailto,
      @Value("${sources.arxiv.oai-url:https://oaipmh.arxiv.org/oai}") String arxivOaiUrl) {
    this.arxivBaseUrl = trimTrailingSlash(arxivBaseUrl);
    this.pubmedEsearchUrl = pubmedEsearchUrl;
    this.pubmedEfetchUrl = pubmedEfetchUrl;
    this.s2GraphUrl = trimTrailingSlash(s2GraphUrl);
    this.s2DatasetsUrl = trimTrailingSlash(s2DatasetsUrl);
    this.s2ApiKey = s2ApiKey;
    this.s2DatasetName = s2DatasetName;
    this.openAlexBaseUrl = trimTrailingSlash(openAlexBaseUrl);
    this.openAlexMailto = openAlexMailto;
    this.arxivOaiUrl = trimTrailingSlash(arxivOaiUrl);
  }

  public boolean hasS2ApiKey() {
    return s2ApiKey != null && !s2ApiKey.isBlank();
  }

  public boolean hasOpenAlexMailto() {
    return openAlexMailto != null && !openAlexMailto.isBlank();
  }

  private static String trimTrailingSlash(String url) {
    if (url == null) {
      return "";
    }
    String value = url.trim();
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
