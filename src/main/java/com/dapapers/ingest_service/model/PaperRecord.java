package com.dapapers.ingest_service.model;

import com.dapapers.ingest_service.ids.DoiNormalizer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * Canonical paper record shared by every source adapter and written to the paper index.
 *
 * <p>{@code id} is the document id and the dedup key: re-importing a paper with the same id
 * overwrites the stored document. Categories are de-duplicated keeping first-seen order, the
 * first one being the primary category. Counts are clamped to zero.
 */
@Builder(toBuilder = true)
public record PaperRecord(
    String id,
    String externalId,
    PaperSource source,
    String title,
    String abstractText,
    List<Author> authors,
    LocalDate publishedDate,
    Integer year,
    String pdfUrl,
    List<String> categories,
    String doi,
    String journal,
    String venue,
    int citationCount,
    int referenceCount,
    int influentialCitationCount,
    boolean openAccess,
    List<String> publicationTypes,
    String sourceUrl,
    String htmlUrl,
    String pmcId,
    String tldr) {

  public PaperRecord {
    title = title == null ? "" : title.trim();
    abstractText = abstractText == null ? "" : abstractText.trim();
    authors = authors == null ? List.of() : List.copyOf(authors);
    categories = dedupe(categories);
    publicationTypes = dedupe(publicationTypes);
    doi = DoiNormalizer.normalize(doi);
    citationCount = Math.max(0, citationCount);
    referenceCount = Math.max(0, referenceCount);
    influentialCitationCount = Math.max(0, influentialCitationCount);
    if (year == null && publishedDate != null) {
      year = publishedDate.getYear();
    }
  }

  /** First category, or empty string when the record has none. */
  public String primaryCategory() {
    return categories.isEmpty() ? "" : categories.get(0);
  }

  /** A record can be indexed only with a non-empty title and a resolvable external id. */
  public boolean isIndexable() {
    return !title.isEmpty()
        && externalId != null
        && !externalId.isBlank()
        && id != null
        && !id.isBlank()
        && source != null;
  }

  public List<String> authorNames() {
    return authors.stream().map(Author::name).filter(n -> !n.isEmpty()).toList();
  }

  private static List<String> dedupe(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    LinkedHashSet<String> unique = new LinkedHashSet<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        unique.add(value.trim());
      }
    }
    return List.copyOf(new ArrayList<>(unique));
  }

  /** Adds single authors in order; the remaining builder methods are generated. */
  public static class PaperRecordBuilder {
    public PaperRecordBuilder author(Author author) {
      List<Author> current = this.authors == null ? new ArrayList<>() : new ArrayList<>(this.authors);
      current.add(Objects.requireNonNull(author));
      this.authors = current;
      return this;
    }
  }
}
