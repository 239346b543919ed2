package com.dapapers.ingest_service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * External identifiers of a paper keyed by registry name (ArXiv, DOI, PubMed, ...). Lookups are
 * case-insensitive on the key.
 */
public final class ExternalIds {

  public static final String ARXIV = "arxiv";
  public static final String DOI = "doi";
  public static final String PUBMED = "pubmed";
  public static final String PUBMED_CENTRAL = "pubmedcentral";
  public static final String PMCID = "pmcid";
  public static final String CORPUS_ID = "corpusid";

  private static final ExternalIds EMPTY = new ExternalIds(Collections.emptyMap());

  private final Map<String, ExternalIdValue> values;

  private ExternalIds(Map<String, ExternalIdValue> values) {
    this.values = values;
  }

  public static ExternalIds empty() {
    return EMPTY;
  }

  public static ExternalIds of(Map<String, ExternalIdValue> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }
    Map<String, ExternalIdValue> normalized = new LinkedHashMap<>();
    values.forEach(
        (key, value) -> {
          if (key != null && value != null && !value.isBlank()) {
            normalized.put(key.toLowerCase(Locale.ROOT), value);
          }
        });
    return new ExternalIds(Collections.unmodifiableMap(normalized));
  }

  /** Builds the map from raw JSON values; strings and numbers are kept, anything else dropped. */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ExternalIds fromJson(Map<String, Object> raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    Map<String, ExternalIdValue> converted = new LinkedHashMap<>();
    raw.forEach(
        (key, value) -> {
          if (value instanceof Number n) {
            converted.put(key, ExternalIdValue.number(new BigDecimal(n.toString())));
          } else if (value instanceof CharSequence s) {
            converted.put(key, ExternalIdValue.text(s.toString()));
          }
        });
    return of(converted);
  }

  public Optional<String> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    ExternalIdValue value = values.get(key.toLowerCase(Locale.ROOT));
    return value == null ? Optional.empty() : Optional.of(value.asString());
  }

  public Optional<String> arxiv() {
    return get(ARXIV);
  }

  public Optional<String> doi() {
    return get(DOI);
  }

  public Optional<String> pubmed() {
    return get(PUBMED);
  }

  public Optional<String> pmcid() {
    Optional<String> pmc = get(PUBMED_CENTRAL);
    return pmc.isPresent() ? pmc : get(PMCID);
  }

  public Optional<String> corpusId() {
    return get(CORPUS_ID);
  }

  public Map<String, ExternalIdValue> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExternalIds other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ExternalIds" + values;
  }
}
