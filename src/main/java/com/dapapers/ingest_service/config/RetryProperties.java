package com.dapapers.ingest_service.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retry settings per upstream use (prefix {@code retry.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "retry")
public class RetryProperties {

  /** Page fetches of the import drivers and dataset manifests. */
  private final Settings paging = new Settings(5, Duration.ofSeconds(5), Duration.ofSeconds(2));

  /** Source searches and single-record lookups. */
  private final Settings search = new Settings(3, Duration.ofSeconds(2), Duration.ofSeconds(1));

  /** Citation lookups of the enrichment job; the job adds its own cooldown on top. */
  private final Settings lookup = new Settings(3, Duration.ofSeconds(5), Duration.ofSeconds(2));

  @Getter
  @Setter
  public static class Settings {
    private int maxAttempts;
    private Duration rateLimitBackoff;
    private Duration errorBackoff;

    public Settings() {}

    public Settings(int maxAttempts, Duration rateLimitBackoff, Duration errorBackoff) {
      this.maxAttempts = maxAttempts;
      this.rateLimitBackoff = rateLimitBackoff;
      this.errorBackoff = errorBackoff;
    }
  }
}
