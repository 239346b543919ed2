package com.dapapers.ingest_service.client;

import com.dapapers.ingest_service.config.RetryProperties;
import org.springframework.stereotype.Component;

/** Builds the {@link RetryPolicy} of each upstream use from {@link RetryProperties}. */
@Component
public class RetryPolicies {

  private final RetryProperties properties;
  private final Sleeper sleeper;

  public RetryPolicies(RetryProperties properties, Sleeper sleeper) {
    this.properties = properties;
    this.sleeper = sleeper;
  }

  public RetryPolicy paging() {
    return build("paging", properties.getPaging());
  }

  public RetryPolicy search() {
    return build("search", properties.getSearch());
  }

  public RetryPolicy lookup() {
    return build("citation-lookup", properties.getLookup());
  }

  private RetryPolicy build(String name, RetryProperties.Settings settings) {
    return RetryPolicy.builder()
        .name(name)
        .maxAttempts(Math.max(1, settings.getMaxAttempts()))
        .rateLimitBackoff(settings.getRateLimitBackoff())
        .errorBackoff(settings.getErrorBackoff())
        .sleeper(sleeper)
        .build();
  }
}
