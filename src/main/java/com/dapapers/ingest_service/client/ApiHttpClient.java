package com.dapapers.ingest_service.client;

import com.dapapers.ingest_service.config.HttpClientConfig;
import com.google.common.primitives.Longs;
import jakarta.annotation.PreDestroy;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpHost;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.springframework.stereotype.Component;

/**
 * HTTP GET client used by every source adapter, optionally via a proxy as configured in {@link
 * HttpClientConfig}.
 *
 * <p>Each call is a single attempt: 429 answers, and 503 answers carrying {@code Retry-After},
 * raise {@link RateLimitedException}; other non-200 answers and transport failures raise {@link
 * ApiFetchException}. Retrying is left to {@link RetryPolicy}.
 */
@Slf4j
@Component
public class ApiHttpClient {

  private static final int ERROR_BODY_PREVIEW = 300;

  private final HttpClientConfig config;
  private final CloseableHttpClient httpClient;
  private final RequestConfig requestConfig;
  private final RequestConfig streamRequestConfig;

  public ApiHttpClient(HttpClientConfig config) {
    this.config = config;
    this.httpClient = createHttpClient();
    this.requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(config.getConnectTimeoutMs())
            .setConnectionRequestTimeout(config.getConnectTimeoutMs())
            .setSocketTimeout(config.getSocketTimeoutMs())
            .build();
    // Dataset files take minutes to download: only the gap between packets is bounded.
    this.streamRequestConfig =
        RequestConfig.custom()
            .setConnectTimeout(config.getConnectTimeoutMs())
            .setConnectionRequestTimeout(config.getConnectTimeoutMs())
            .setSocketTimeout(config.getStreamSocketTimeoutMs())
            .build();
  }

  private CloseableHttpClient createHttpClient() {
    HttpClientBuilder clientBuilder = HttpClients.custom().setUserAgent(config.getUserAgent());
    if (config.isProxyConfigured()) {
      log.info("Using HTTP proxy {}", config.getProxyAddress());
      clientBuilder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
    }
    return clientBuilder.build();
  }

  public String get(String url) throws ApiFetchException {
    return get(url, Map.of());
  }

  /**
   * Fetches the body of {@code url} as a UTF-8 string.
   *
   * @param headers extra request headers, e.g. {@code x-api-key}
   * @throws RateLimitedException on HTTP 429, or 503 with {@code Retry-After}
   * @throws ApiFetchException on any other non-200 status or I/O failure
   */
  public String get(String url, Map<String, String> headers) throws ApiFetchException {
    HttpGet httpGet = newRequest(url, headers, requestConfig);
    log.debug("GET {}", url);
    try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
      String body = readBody(response.getEntity());
      checkStatus(url, response, body);
      return body;
    } catch (IOException e) {
      throw new ApiFetchException("Request to " + url + " failed: " + e.getMessage(), e);
    }
  }

  /**
   * Opens {@code url} and hands the response body to {@code handler} while the connection is open.
   * Uses the streaming socket timeout and no overall deadline. I/O failures raised by the handler
   * are reported as {@link ApiFetchException}.
   *
   * <p>When the handler throws, or {@code fullyRead} rejects its result, the request is aborted
   * so the rest of the body is never transferred.
   */
  public <T> T stream(
      String url,
      Map<String, String> headers,
      StreamHandler<T> handler,
      Predicate<? super T> fullyRead)
      throws ApiFetchException {
    HttpGet httpGet = newRequest(url, headers, streamRequestConfig);
    try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
      int statusCode = response.getStatusLine().getStatusCode();
      if (statusCode != HttpStatus.SC_OK) {
        checkStatus(url, response, readBody(response.getEntity()));
      }
      HttpEntity entity = response.getEntity();
      if (entity == null) {
        throw new ApiFetchException("Empty response body from " + url);
      }
      InputStream content = entity.getContent();
      T result;
      try {
        result = handler.handle(new HandlerOwnedStream(content));
      } catch (IOException | RuntimeException e) {
        httpGet.abort();
        throw e;
      }
      if (fullyRead.test(result)) {
        content.close();
      } else {
        log.info("Abandoning the rest of {}", url);
        httpGet.abort();
      }
      return result;
    } catch (IOException e) {
      throw new ApiFetchException("Streaming " + url + " failed: " + e.getMessage(), e);
    }
  }

  private HttpGet newRequest(String url, Map<String, String> headers, RequestConfig rc)
      throws ApiFetchException {
    if (url == null || url.isBlank()) {
      throw new ApiFetchException("URL must not be blank", HttpStatus.SC_BAD_REQUEST);
    }
    HttpGet httpGet = new HttpGet(url);
    httpGet.setConfig(rc);
    if (headers != null) {
      headers.forEach(httpGet::setHeader);
    }
    return httpGet;
  }

  private static String readBody(HttpEntity entity) throws IOException {
    return entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
  }

  private static void checkStatus(String url, HttpResponse response, String body)
      throws ApiFetchException {
    int statusCode = response.getStatusLine().getStatusCode();
    if (statusCode == HttpStatus.SC_OK) {
      return;
    }
    Duration retryAfter = retryAfter(response.getFirstHeader(HttpHeaders.RETRY_AFTER));
    if (statusCode == 429
        || (statusCode == HttpStatus.SC_SERVICE_UNAVAILABLE && retryAfter != null)) {
      throw new RateLimitedException(
          String.format("Rate limited (%d) by %s", statusCode, url), statusCode, retryAfter);
    }
    throw new ApiFetchException(
        String.format("HTTP %d from %s: %s", statusCode, url, preview(body)), statusCode);
  }

  /** {@code Retry-After} as delta-seconds or HTTP-date; null when absent or unreadable. */
  static Duration retryAfter(Header header) {
    if (header == null || header.getValue() == null || header.getValue().isBlank()) {
      return null;
    }
    String value = header.getValue().trim();
    Long seconds = Longs.tryParse(value);
    if (seconds != null) {
      return seconds < 0 ? null : Duration.ofSeconds(seconds);
    }
    Date date = DateUtils.parseDate(value);
    if (date == null) {
      return null;
    }
    Duration untilDate = Duration.between(Instant.now(), date.toInstant());
    return untilDate.isNegative() ? Duration.ZERO : untilDate;
  }

  private static String preview(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= ERROR_BODY_PREVIEW
        ? body
        : body.substring(0, ERROR_BODY_PREVIEW) + "...";
  }

  /**
   * Body view handed to stream handlers. Closing it is a no-op: closing the entity stream reads
   * it to the end, so only {@link #stream} decides between closing and aborting.
   */
  private static class HandlerOwnedStream extends FilterInputStream {
    HandlerOwnedStream(InputStream in) {
      super(in);
    }

    @Override
    public void close() {}
  }

  @PreDestroy
  public void cleanup() {
    try {
      httpClient.close();
      log.info("HTTP client closed successfully");
    } catch (IOException e) {
      log.error("Error closing HTTP client", e);
    }
  }
}
