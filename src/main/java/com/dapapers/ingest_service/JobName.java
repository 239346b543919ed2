package com.dapapers.ingest_service;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Jobs selectable with {@code job.name}. */
public enum JobName {
  NONE("none"),
  /** Semantic Scholar bulk dataset files. */
  S2_IMPORT("s2-import"),
  /** OpenAlex cursor export of arXiv works. */
  OPENALEX_IMPORT("openalex-import"),
  /** Semantic Scholar Graph API bulk search. */
  S2_BULK_SEARCH_IMPORT("s2-bulk-search-import"),
  /** arXiv OAI-PMH ListRecords harvest. */
  ARXIV_OAI_IMPORT("arxiv-oai-import"),
  ENRICH("enrich");

  private final String propertyValue;

  JobName(String propertyValue) {
    this.propertyValue = propertyValue;
  }

  public String getPropertyValue() {
    return propertyValue;
  }

  /**
   * @throws IllegalStateException for an unknown job name
   */
  public static JobName fromProperty(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    return Arrays.stream(values())
        .filter(job -> job.propertyValue.equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Unknown job.name '"
                        + value
                        + "', expected one of "
                        + Arrays.stream(values())
                            .map(JobName::getPropertyValue)
                            .collect(Collectors.joining(", "))));
  }
}
