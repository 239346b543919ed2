package com.dapapers.ingest_service.sources;

import com.dapapers.ingest_service.ids.DoiNormalizer;
import com.google.common.base.Strings;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/** Null-safe text helpers shared by the adapters. */
public final class Texts {

  private Texts() {}

  /** Trims and collapses runs of whitespace (feeds wrap long titles over several lines). */
  public static String clean(String value) {
    return Strings.nullToEmpty(value).trim().replaceAll("\\s+", " ");
  }

  public static boolean hasText(String value) {
    return !Strings.isNullOrEmpty(value) && !value.isBlank();
  }

  /** Parses {@code yyyy-MM-dd}; falls back to January 1 of {@code year} when given. */
  public static LocalDate parseIsoDate(String value, Integer year) {
    if (hasText(value)) {
      try {
        return LocalDate.parse(value.trim());
      } catch (DateTimeParseException e) {
        // fall through to the year
      }
    }
    if (year != null && year > 0) {
      return LocalDate.of(year, 1, 1);
    }
    return null;
  }

  public static String arxivPdfUrl(String arxivId) {
    return "https://arxiv.org/pdf/" + arxivId;
  }

  /** Resolver URL for a DOI given bare or already prefixed. */
  public static String doiUrl(String doi) {
    return "https://doi.org/" + DoiNormalizer.normalize(doi);
  }

  /** {@code PMC}-prefixed form of a PubMed Central id; some registries report the bare number. */
  public static String pmcId(String value) {
    if (!hasText(value)) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.toUpperCase(Locale.ROOT).startsWith("PMC") ? trimmed : "PMC" + trimmed;
  }

  public static String pmcArticleUrl(String pmcId) {
    return "https://www.ncbi.nlm.nih.gov/pmc/articles/" + pmcId + "/";
  }
}
