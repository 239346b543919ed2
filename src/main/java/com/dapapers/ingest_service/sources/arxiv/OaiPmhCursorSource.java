package com.dapapers.ingest_service.sources.arxiv;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.config.SourcesConfig;
import com.dapapers.ingest_service.driver.CursorPage;
import com.dapapers.ingest_service.driver.CursorPageSource;
import com.dapapers.ingest_service.ids.ArxivIdExtractor;
import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.Mappers;
import com.dapapers.ingest_service.sources.QueryUrl;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.dapapers.ingest_service.sources.Texts;
import com.dapapers.ingest_service.sources.arxiv.OaiPmhResponse.ArxivAuthor;
import com.dapapers.ingest_service.sources.arxiv.OaiPmhResponse.ArxivMetadata;
import com.dapapers.ingest_service.sources.arxiv.OaiPmhResponse.OaiRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.base.Splitter;
import com.google.common.primitives.Longs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Bulk harvest of arXiv metadata over OAI-PMH {@code ListRecords}. The cursor is the resumption
 * token of the next page; an empty cursor starts a new list restricted by the configured set and
 * datestamp range. Requests are spaced by {@code ingest.oai.request-interval}.
 *
 * <p>Deleted records and records without an id or title are skipped. The newest datestamp of
 * any harvested record, deleted ones included, is kept so the next incremental harvest can start
 * from it.
 */
@Slf4j
@Component
public class OaiPmhCursorSource implements CursorPageSource<OaiRecord> {

  static final String NO_RECORDS_MATCH = "noRecordsMatch";

  private static final Splitter WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings();

  private final ApiHttpClient httpClient;
  private final SourcesConfig sourcesConfig;
  private final IngestProperties.Oai settings;
  private final XmlMapper xmlMapper = Mappers.xml();
  private final AtomicReference<String> latestDatestamp = new AtomicReference<>();

  public OaiPmhCursorSource(
      ApiHttpClient httpClient, SourcesConfig sourcesConfig, IngestProperties ingestProperties) {
    this.httpClient = httpClient;
    this.sourcesConfig = sourcesConfig;
    this.settings = ingestProperties.getOai();
  }

  @Override
  public String name() {
    return "arxiv-oai-pmh";
  }

  @Override
  public Duration minPageInterval() {
    return settings.getRequestInterval() == null ? Duration.ZERO : settings.getRequestInterval();
  }

  /** Newest record datestamp harvested so far, if any. */
  public Optional<String> getLatestDatestamp() {
    return Optional.ofNullable(latestDatestamp.get());
  }

  /**
   * @throws ApiFetchException when the repository answers with an OAI-PMH error other than {@code
   *     noRecordsMatch}, e.g. an expired resumption token; not retryable
   */
  @Override
  public CursorPage<OaiRecord> fetchPage(String cursor) throws ApiFetchException {
    String url = listRecordsUrl(cursor);
    OaiPmhResponse response;
    try {
      response = xmlMapper.readValue(httpClient.get(url), OaiPmhResponse.class);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse OAI-PMH ListRecords response", e);
    }

    if (response.getError() != null) {
      String code = response.getError().getCode();
      if (NO_RECORDS_MATCH.equals(code)) {
        log.info("OAI-PMH: no records match {}", url);
        return new CursorPage<>(List.of(), null, 0);
      }
      throw new ApiFetchException(
          String.format(
              "OAI-PMH error [%s]: %s", code, Texts.clean(response.getError().getMessage())),
          HttpStatus.SC_BAD_REQUEST);
    }

    OaiPmhResponse.ListRecords listRecords = response.getListRecords();
    if (listRecords == null) {
      return new CursorPage<>(List.of(), null, 0);
    }
    String nextToken = null;
    long total = 0;
    OaiPmhResponse.ResumptionToken token = listRecords.getResumptionToken();
    if (token != null) {
      nextToken = Texts.hasText(token.getToken()) ? token.getToken().trim() : null;
      Long size = Longs.tryParse(Texts.clean(token.getCompleteListSize()));
      total = size == null ? 0 : size;
    }
    return new CursorPage<>(listRecords.getRecords(), nextToken, total);
  }

  String listRecordsUrl(String cursor) {
    QueryUrl url = QueryUrl.of(sourcesConfig.getArxivOaiUrl()).param("verb", "ListRecords");
    if (Texts.hasText(cursor)) {
      // A resumption token request takes no other argument.
      return url.param("resumptionToken", cursor.trim()).build();
    }
    return url.param("metadataPrefix", settings.getMetadataPrefix())
        .param("set", settings.getSet())
        .param("from", settings.getFrom())
        .param("until", settings.getUntil())
        .build();
  }

  @Override
  public Optional<PaperRecord> convert(OaiRecord record) {
    OaiPmhResponse.Header header = record.getHeader();
    if (header != null && Texts.hasText(header.getDatestamp())) {
      String datestamp = header.getDatestamp().trim();
      latestDatestamp.accumulateAndGet(
          datestamp,
          (current, seen) -> current == null || seen.compareTo(current) > 0 ? seen : current);
    }
    if (header != null && "deleted".equalsIgnoreCase(Texts.clean(header.getStatus()))) {
      log.debug("Skipping deleted record {}", header.getIdentifier());
      return Optional.empty();
    }
    ArxivMetadata meta = record.getMetadata() == null ? null : record.getMetadata().getArxiv();
    if (meta == null || !Texts.hasText(meta.getId()) || !Texts.hasText(meta.getTitle())) {
      return Optional.empty();
    }

    String arxivId = ArxivIdExtractor.normalize(meta.getId());
    return Optional.of(
        PaperRecord.builder()
            .id(arxivId)
            .externalId(arxivId)
            .source(PaperSource.ARXIV)
            .title(Texts.clean(meta.getTitle()))
            .abstractText(Texts.clean(meta.getAbstractText()))
            .authors(authors(meta.getAuthors()))
            .publishedDate(Texts.parseIsoDate(meta.getCreated(), null))
            .pdfUrl(Texts.arxivPdfUrl(arxivId))
            .categories(WHITESPACE.splitToList(Texts.clean(meta.getCategories())))
            .doi(meta.getDoi())
            .journal(Texts.hasText(meta.getJournalRef()) ? Texts.clean(meta.getJournalRef()) : null)
            .openAccess(true)
            .sourceUrl("https://arxiv.org/abs/" + arxivId)
            .htmlUrl("https://ar5iv.labs.arxiv.org/html/" + arxivId)
            .build());
  }

  private static List<Author> authors(List<ArxivAuthor> authors) {
    List<Author> result = new ArrayList<>();
    if (authors == null) {
      return result;
    }
    for (ArxivAuthor author : authors) {
      String name = Texts.clean(Texts.clean(author.getForenames()) + " " + author.getKeyname());
      if (Texts.hasText(author.getSuffix())) {
        name = name + " " + author.getSuffix().trim();
      }
      if (name.isEmpty()) {
        continue;
      }
      String affiliation =
          author.getAffiliations() == null || author.getAffiliations().isEmpty()
              ? null
              : author.getAffiliations().get(0);
      result.add(new Author(name, affiliation));
    }
    return result;
  }
}
