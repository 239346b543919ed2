package com.dapapers.ingest_service.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Connection settings shared by every upstream client: proxy, per-call timeouts and the
 * User-Agent header.
 */
@Getter
@Component
public class HttpClientConfig {

  private final String proxyHost;
  private final Integer proxyPort;
  private final int connectTimeoutMs;
  private final int socketTimeoutMs;
  private final int streamSocketTimeoutMs;
  private final String userAgent;

  public HttpClientConfig(
      @Value("${http.proxy.host:}") String proxyHost,
      @Value("${http.proxy.port:#{null}}") Integer proxyPort,
      @Value("${http.timeout.connect-ms:10000}") int connectTimeoutMs,
      @Value("${http.timeout.socket-ms:60000}") int socketTimeoutMs,
      @Value("${http.timeout.stream-socket-ms:300000}") int streamSocketTimeoutMs,
      @Value("${http.user-agent:DAPapers/1.0}") String userAgent) {
    this.proxyHost = proxyHost;
    this.proxyPort = proxyPort;
    this.connectTimeoutMs = connectTimeoutMs;
    this.socketTimeoutMs = socketTimeoutMs;
    this.streamSocketTimeoutMs = streamSocketTimeoutMs;
    this.userAgent = userAgent;
  }

  public boolean isProxyConfigured() {
    return proxyHost != null && !proxyHost.isEmpty() && proxyPort != null;
  }

  public String getProxyAddress() {
    return isProxyConfigured() ? proxyHost + ":" + proxyPort : "";
  }
}
