package com.dapapers.ingest_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Paper author as stored in the index.
 *
 * @param name display name, trimmed
 * @param affiliation first known affiliation, may be null
 * @param authorId upstream author id (Semantic Scholar), may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Author(String name, String affiliation, String authorId) {

  public Author {
    name = name == null ? "" : name.trim();
    affiliation = blankToNull(affiliation);
    authorId = blankToNull(authorId);
  }

  public Author(String name, String affiliation) {
    this(name, affiliation, null);
  }

  public static Author of(String name) {
    return new Author(name, null, null);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
