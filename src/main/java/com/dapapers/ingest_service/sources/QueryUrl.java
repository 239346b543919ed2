package com.dapapers.ingest_service.sources;

import java.net.URISyntaxException;
import org.apache.http.client.utils.URIBuilder;

/** Builds request URLs with encoded query parameters. Blank values are skipped. */
public final class QueryUrl {

  private final URIBuilder builder;

  private QueryUrl(URIBuilder builder) {
    this.builder = builder;
  }

  /**
   * @throws IllegalStateException if {@code base} is not a valid URI; base URLs come from
   *     configuration
   */
  public static QueryUrl of(String base) {
    try {
      return new QueryUrl(new URIBuilder(base));
    } catch (URISyntaxException e) {
      throw new IllegalStateException("Invalid base URL: " + base, e);
    }
  }

  public QueryUrl param(String name, Object value) {
    if (value != null && Texts.hasText(value.toString())) {
      builder.addParameter(name, value.toString());
    }
    return this;
  }

  public String build() {
    return builder.toString();
  }

  @Override
  public String toString() {
    return build();
  }
}
