package com.dapapers.ingest_service;

import com.dapapers.ingest_service.client.RetryPolicies;
import com.dapapers.ingest_service.client.Sleeper;
import com.dapapers.ingest_service.config.RetryProperties;
import com.dapapers.ingest_service.config.SourcesConfig;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/** Shared helpers of the unit tests. */
public final class TestFixtures {

  public static final String ARXIV_URL = "http://arxiv.test/api/query";
  public static final String ESEARCH_URL = "http://eutils.test/esearch.fcgi";
  public static final String EFETCH_URL = "http://eutils.test/efetch.fcgi";
  public static final String S2_GRAPH_URL = "http://s2.test/graph/v1";
  public static final String S2_DATASETS_URL = "http://s2.test/datasets/v1";
  public static final String OPENALEX_URL = "http://openalex.test";
  public static final String OAI_URL = "http://oai.test/oai";

  private TestFixtures() {}

  public static SourcesConfig sourcesConfig() {
    return sourcesConfig("test-key", "dev@example.org");
  }

  public static SourcesConfig sourcesConfig(String s2ApiKey, String mailto) {
    return new SourcesConfig(
        ARXIV_URL,
        ESEARCH_URL,
        EFETCH_URL,
        S2_GRAPH_URL,
        S2_DATASETS_URL,
        s2ApiKey,
        "papers",
        OPENALEX_URL,
        mailto,
        OAI_URL);
  }

  /** Policies with the default attempt counts that never actually wait. */
  public static RetryPolicies retryPolicies(Sleeper sleeper) {
    return new RetryPolicies(new RetryProperties(), sleeper);
  }

  public static RetryPolicies retryPolicies() {
    return retryPolicies(new RecordingSleeper());
  }

  public static String resource(String path) {
    try (InputStream in = TestFixtures.class.getResourceAsStream("/fixtures/" + path)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] gzip(String content) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write(content.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  /** Records requested waits instead of sleeping. */
  public static class RecordingSleeper implements Sleeper {

    private final List<Duration> waits = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
      waits.add(duration);
    }

    public List<Duration> getWaits() {
      return waits;
    }
  }
}
