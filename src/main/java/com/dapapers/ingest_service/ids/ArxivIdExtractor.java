package com.dapapers.ingest_service.ids;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds arXiv identifiers in URLs and DOIs.
 *
 * <p>Location URLs are tried against four patterns in a fixed order: new-style abstract page,
 * new-style PDF (which also covers the {@code export.arxiv.org} mirror), old-style abstract page
 * and old-style PDF. The first location that matches any pattern wins. When no location matches,
 * the DataCite DOI form {@code 10.48550/arxiv.<id>} is tried on the record DOI and then on every
 * location URL. Input is lower-cased before matching and a trailing {@code v<digits>} is removed.
 */
public final class ArxivIdExtractor {

  private static final String NEW_ID = "(\\d+\\.\\d+)";
  private static final String OLD_ID = "([a-z-]+(?:\\.[a-z]{2})?/\\d+)";

  private static final List<Pattern> LOCATION_PATTERNS =
      List.of(
          Pattern.compile("arxiv\\.org/abs/" + NEW_ID),
          Pattern.compile("arxiv\\.org/pdf/" + NEW_ID),
          Pattern.compile("arxiv\\.org/abs/" + OLD_ID),
          Pattern.compile("arxiv\\.org/pdf/" + OLD_ID));

  private static final Pattern DOI_PATTERN =
      Pattern.compile("10\\.48550/arxiv\\.(\\d+\\.\\d+|[a-z-]+(?:\\.[a-z]{2})?/\\d+)");

  private static final Pattern TRAILING_VERSION = Pattern.compile("v\\d+$");

  private ArxivIdExtractor() {}

  /**
   * Resolves an arXiv id from the location URLs of a work and its DOI.
   *
   * @param locationUrls landing page URLs in upstream order; null entries are ignored
   * @param doi the record DOI, with or without resolver prefix; may be null
   */
  public static Optional<String> extract(List<String> locationUrls, String doi) {
    List<String> urls = locationUrls == null ? List.of() : locationUrls;
    for (String url : urls) {
      Optional<String> fromLocation = fromLocationUrl(url);
      if (fromLocation.isPresent()) {
        return fromLocation;
      }
    }
    Optional<String> fromDoi = fromDoi(doi);
    if (fromDoi.isPresent()) {
      return fromDoi;
    }
    for (String url : urls) {
      Optional<String> fromUrl = fromDoi(url);
      if (fromUrl.isPresent()) {
        return fromUrl;
      }
    }
    return Optional.empty();
  }

  /** Matches one landing page URL against the abstract and PDF page patterns only. */
  public static Optional<String> fromLocationUrl(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    String lower = url.toLowerCase(Locale.ROOT);
    for (Pattern pattern : LOCATION_PATTERNS) {
      Matcher m = pattern.matcher(lower);
      if (m.find()) {
        return Optional.of(m.group(1));
      }
    }
    return Optional.empty();
  }

  /** Matches the {@code 10.48550/arxiv.<id>} DOI form anywhere in the value. */
  public static Optional<String> fromDoi(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    Matcher m = DOI_PATTERN.matcher(value.toLowerCase(Locale.ROOT));
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }

  /**
   * Takes the segment after {@code /abs/} of an Atom entry id and strips the version, so
   * {@code http://arxiv.org/abs/2301.00001v1} gives {@code 2301.00001}.
   */
  public static Optional<String> fromAbsUrl(String url) {
    if (url == null) {
      return Optional.empty();
    }
    int idx = url.indexOf("/abs/");
    if (idx < 0) {
      return Optional.empty();
    }
    String id = normalize(url.substring(idx + "/abs/".length()));
    return id.isEmpty() ? Optional.empty() : Optional.of(id);
  }

  /**
   * Canonical form of a bare arXiv id: trimmed, lower-cased, without an {@code arXiv:} prefix,
   * trailing slash or version suffix.
   */
  public static String normalize(String id) {
    if (id == null) {
      return "";
    }
    String value = id.trim().toLowerCase(Locale.ROOT);
    if (value.startsWith("arxiv:")) {
      value = value.substring("arxiv:".length());
    }
    while (value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    return TRAILING_VERSION.matcher(value).replaceFirst("");
  }
}
