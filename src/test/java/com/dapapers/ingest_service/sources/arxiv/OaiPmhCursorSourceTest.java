package com.dapapers.ingest_service.sources.arxiv;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dapapers.ingest_service.TestFixtures;
import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.driver.CursorPage;
import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.dapapers.ingest_service.sources.SourceParseException;
import com.dapapers.ingest_service.sources.arxiv.OaiPmhResponse.OaiRecord;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OaiPmhCursorSourceTest {

  @Mock private ApiHttpClient httpClient;

  private final IngestProperties properties = new IngestProperties();
  private OaiPmhCursorSource source;

  @BeforeEach
  void setUp() {
    properties.getOai().setSet("cs");
    properties.getOai().setFrom("2024-03-01");
    source = new OaiPmhCursorSource(httpClient, TestFixtures.sourcesConfig(), properties);
  }

  private String requestedUrl() throws ApiFetchException {
    ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
    verify(httpClient).get(url.capture());
    return URLDecoder.decode(url.getValue(), StandardCharsets.UTF_8);
  }

  @Test
  void fetchPage_firstPage_listRestrictedBySetAndFrom() throws ApiFetchException {
    when(httpClient.get(anyString()))
        .thenReturn(TestFixtures.resource("arxiv/oai-list-records.xml"));

    CursorPage<OaiRecord> page = source.fetchPage(null);

    String url = requestedUrl();
    assertTrue(url.startsWith(TestFixtures.OAI_URL + "?verb=ListRecords"));
    assertTrue(url.contains("metadataPrefix=arXiv"));
    assertTrue(url.contains("set=cs"));
    assertTrue(url.contains("from=2024-03-01"));
    assertFalse(url.contains("until="));
    assertFalse(url.contains("resumptionToken"));

    assertEquals(4, page.items().size());
    assertEquals("6960524|1001", page.nextCursor());
    assertEquals(6960524, page.total());
    assertTrue(page.hasNext());
  }

  @Test
  void fetchPage_resumptionToken_sentAlone() throws ApiFetchException {
    when(httpClient.get(anyString())).thenReturn(TestFixtures.resource("arxiv/oai-last-page.xml"));

    CursorPage<OaiRecord> page = source.fetchPage("6960524|1001");

    String url = requestedUrl();
    assertEquals(TestFixtures.OAI_URL + "?verb=ListRecords&resumptionToken=6960524|1001", url);

    assertEquals(1, page.items().size());
    assertNull(page.nextCursor());
    assertFalse(page.hasNext());
    assertEquals(1002, page.total());
  }

  @Test
  void fetchPage_noRecordsMatch_emptyLastPage() throws ApiFetchException {
    when(httpClient.get(anyString())).thenReturn(TestFixtures.resource("arxiv/oai-no-records.xml"));

    CursorPage<OaiRecord> page = source.fetchPage(null);

    assertTrue(page.isEmpty());
    assertFalse(page.hasNext());
  }

  @Test
  void fetchPage_badResumptionToken_notRetryable() throws ApiFetchException {
    when(httpClient.get(anyString())).thenReturn(TestFixtures.resource("arxiv/oai-bad-token.xml"));

    ApiFetchException e = assertThrows(ApiFetchException.class, () -> source.fetchPage("stale"));

    assertTrue(e.getMessage().contains("badResumptionToken"));
    assertFalse(e.isRetryable());
  }

  @Test
  void fetchPage_notXml_parseError() throws ApiFetchException {
    when(httpClient.get(anyString())).thenReturn("Service temporarily unavailable");

    assertThrows(SourceParseException.class, () -> source.fetchPage(null));
  }

  @Test
  void convert_arxivMetadata_mappedToPaperRecord() throws ApiFetchException {
    when(httpClient.get(anyString()))
        .thenReturn(TestFixtures.resource("arxiv/oai-list-records.xml"));

    PaperRecord paper = source.convert(source.fetchPage(null).items().get(0)).orElseThrow();

    assertEquals("1706.03762", paper.id());
    assertEquals("1706.03762", paper.externalId());
    assertEquals(PaperSource.ARXIV, paper.source());
    assertEquals("Attention Is All You Need", paper.title());
    assertEquals(
        "The dominant sequence transduction models are based on complex recurrent or"
            + " convolutional neural networks.",
        paper.abstractText());
    assertEquals(
        List.of(
            new Author("Ashish Vaswani", "Google Brain"),
            new Author("Noam Shazeer", null),
            new Author("Aidan N. Gomez Jr", null)),
        paper.authors());
    assertEquals(LocalDate.of(2017, 6, 12), paper.publishedDate());
    assertEquals(2017, paper.year());
    assertEquals(List.of("cs.CL", "cs.LG"), paper.categories());
    assertEquals("cs.CL", paper.primaryCategory());
    assertEquals("10.48550/arXiv.1706.03762", paper.doi());
    assertEquals("Advances in Neural Information Processing Systems 30 (2017)", paper.journal());
    assertEquals("https://arxiv.org/pdf/1706.03762", paper.pdfUrl());
    assertEquals("https://arxiv.org/abs/1706.03762", paper.sourceUrl());
    assertTrue(paper.openAccess());
  }

  @Test
  void convert_oldStyleIdAndSurnameOnlyAuthor() throws ApiFetchException {
    when(httpClient.get(anyString()))
        .thenReturn(TestFixtures.resource("arxiv/oai-list-records.xml"));

    PaperRecord paper = source.convert(source.fetchPage(null).items().get(2)).orElseThrow();

    assertEquals("cs/0112017", paper.id());
    assertEquals(List.of(Author.of("Turing")), paper.authors());
    assertNull(paper.journal());
    assertNull(paper.doi());
  }

  @Test
  void convert_deletedOrUntitledRecords_skipped() throws ApiFetchException {
    when(httpClient.get(anyString()))
        .thenReturn(TestFixtures.resource("arxiv/oai-list-records.xml"));
    List<OaiRecord> records = source.fetchPage(null).items();

    assertEquals(Optional.empty(), source.convert(records.get(1)));
    assertEquals(Optional.empty(), source.convert(records.get(3)));
  }

  @Test
  void convert_everyRecord_latestDatestampTracked() throws ApiFetchException {
    when(httpClient.get(anyString()))
        .thenReturn(TestFixtures.resource("arxiv/oai-list-records.xml"));
    assertEquals(Optional.empty(), source.getLatestDatestamp());

    source.fetchPage(null).items().forEach(source::convert);

    assertEquals(Optional.of("2024-03-04"), source.getLatestDatestamp());
  }

  @Test
  void minPageInterval_configuredRequestInterval() {
    assertEquals(Duration.ofSeconds(3), source.minPageInterval());

    properties.getOai().setRequestInterval(Duration.ofSeconds(5));

    assertEquals(Duration.ofSeconds(5), source.minPageInterval());
  }
}
