package com.dapapers.ingest_service.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Citation enrichment settings (prefix {@code enrich.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "enrich")
public class EnrichmentProperties {

  /** Papers per lookup request; OpenAlex accepts at most 50 DOIs in one filter. */
  private int batchSize = 50;

  /** Stop after this many papers; 0 means all unenriched papers. */
  private int limit;

  /** Wait between lookup requests. */
  private Duration rateDelay = Duration.ofMillis(100);

  /** Wait after a failed lookup before retrying the same selection. */
  private Duration cooldown = Duration.ofSeconds(30);

  /** Consecutive failed lookups after which the run is aborted. */
  private int maxConsecutiveFailures = 10;
}
