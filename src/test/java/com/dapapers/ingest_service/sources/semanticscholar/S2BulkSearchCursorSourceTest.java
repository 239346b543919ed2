package com.dapapers.ingest_service.sources.semanticscholar;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dapapers.ingest_service.TestFixtures;
import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.client.ApiHttpClient;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.driver.CursorPage;
import com.dapapers.ingest_service.model.PaperSource;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class S2BulkSearchCursorSourceTest {

  private static final String PAGE =
      "{\"total\":2,\"token\":\"NEXT\",\"data\":["
          + "{\"corpusId\":13756489,\"externalIds\":{\"ArXiv\":\"1706.03762\"},"
          + "\"title\":\"Attention is All you Need\"},"
          + "{\"paperId\":\"abc\",\"externalIds\":{},\"title\":\"\"}]}";

  @Mock private ApiHttpClient httpClient;

  private S2BulkSearchCursorSource source;

  @BeforeEach
  void setUp() {
    IngestProperties properties = new IngestProperties();
    properties.getS2().setBulkQuery("transformer");
    source = new S2BulkSearchCursorSource(httpClient, TestFixtures.sourcesConfig(), properties);
  }

  @Test
  void fetchPage_firstPage_noTokenAndNextTokenReturned() throws ApiFetchException {
    when(httpClient.get(anyString(), anyMap())).thenReturn(PAGE);

    CursorPage<S2Paper> page = source.fetchPage("");

    ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
    verify(httpClient).get(url.capture(), eq(Map.of("x-api-key", "test-key")));
    String decoded = URLDecoder.decode(url.getValue(), StandardCharsets.UTF_8);
    assertTrue(decoded.startsWith(TestFixtures.S2_GRAPH_URL + "/paper/search/bulk?"));
    assertTrue(decoded.contains("query=transformer"));
    assertFalse(decoded.contains("token="));
    assertEquals("NEXT", page.nextCursor());
    assertEquals(2, page.total());
    assertEquals(2, page.items().size());
  }

  @Test
  void fetchPage_lastPage_noNext() throws ApiFetchException {
    when(httpClient.get(anyString(), anyMap())).thenReturn("{\"total\":2,\"data\":[]}");

    CursorPage<S2Paper> page = source.fetchPage("NEXT");

    ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
    verify(httpClient).get(url.capture(), anyMap());
    assertTrue(url.getValue().contains("token=NEXT"));
    assertFalse(page.hasNext());
  }

  @Test
  void convert_titledArxivPaperKept_untitledDropped() throws ApiFetchException {
    when(httpClient.get(anyString(), anyMap())).thenReturn(PAGE);
    CursorPage<S2Paper> page = source.fetchPage(null);

    assertEquals(PaperSource.ARXIV, source.convert(page.items().get(0)).orElseThrow().source());
    assertTrue(source.convert(page.items().get(1)).isEmpty());
  }

  @Test
  void fetchPage_recordOfWrongShape_skippedAndCounted() throws ApiFetchException {
    when(httpClient.get(anyString(), anyMap()))
        .thenReturn(
            "{\"total\":2,\"data\":["
                + "{\"corpusId\":1,\"title\":\"Kept\"},"
                + "{\"corpusId\":2,\"citationCount\":{\"value\":3}}]}");

    CursorPage<S2Paper> page = source.fetchPage("TOKEN");

    assertEquals(1, page.items().size());
    assertEquals(1, page.unreadable());
    assertFalse(page.hasNext());
  }
}
