package com.dapapers.ingest_service.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Source tag of a canonical paper record. The tag is part of the record identity together with
 * the external id.
 */
public enum PaperSource {
  ARXIV("arxiv"),
  SEMANTIC_SCHOLAR("semanticscholar"),
  PUBMED("pubmed"),
  /** Records whose identity comes from an OpenAlex work id (no arXiv or PubMed id found). */
  OPENALEX("openalex"),
  ;

  private final String tag;

  PaperSource(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  public static Optional<PaperSource> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.tag.equalsIgnoreCase(tag.trim())).findFirst();
  }
}
