package com.dapapers.ingest_service.ids;

import java.util.Locale;

/** Strips resolver prefixes from DOIs so the same DOI always compares equal. */
public final class DoiNormalizer {

  private static final String[] PREFIXES = {
    "https://doi.org/", "http://doi.org/", "https://dx.doi.org/", "http://dx.doi.org/", "doi:"
  };

  private DoiNormalizer() {}

  /**
   * Returns the bare DOI ({@code 10.xxxx/...}) or {@code null} when the input is null or blank.
   */
  public static String normalize(String doi) {
    if (doi == null) {
      return null;
    }
    String value = doi.trim();
    String lower = value.toLowerCase(Locale.ROOT);
    for (String prefix : PREFIXES) {
      if (lower.startsWith(prefix)) {
        value = value.substring(prefix.length());
        break;
      }
    }
    return value.isEmpty() ? null : value;
  }
}
