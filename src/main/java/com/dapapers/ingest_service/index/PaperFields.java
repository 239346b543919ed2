package com.dapapers.ingest_service.index;

/** Field names of paper documents. */
public final class PaperFields {

  /** Document id; the dedup key of {@code updateDocument}. */
  public static final String ID = "id";

  public static final String EXTERNAL_ID = "external_id";
  public static final String SOURCE = "source";
  public static final String TITLE = "title";
  public static final String ABSTRACT = "abstract";

  /** Stored JSON array of authors. */
  public static final String AUTHORS = "authors";

  /** Indexed author names, not stored. */
  public static final String AUTHOR_NAMES = "author_names";

  public static final String PUBLISHED_DATE = "published_date";
  public static final String YEAR = "year";
  public static final String PDF_URL = "pdf_url";
  public static final String PRIMARY_CATEGORY = "primary_category";
  public static final String CATEGORIES = "categories";
  public static final String DOI = "doi";
  public static final String JOURNAL = "journal";
  public static final String VENUE = "venue";
  public static final String VENUE_TEXT = "venue_text";

  /** Doc-values only so the enrichment job can update it in place. */
  public static final String CITATION_COUNT = "citation_count";

  public static final String REFERENCE_COUNT = "reference_count";
  public static final String INFLUENTIAL_CITATION_COUNT = "influential_citation_count";
  public static final String IS_OPEN_ACCESS = "is_open_access";
  public static final String PUBLICATION_TYPES = "publication_types";
  public static final String SOURCE_URL = "source_url";
  public static final String HTML_URL = "html_url";
  public static final String PMC_ID = "pmc_id";
  public static final String TLDR = "tldr";

  private PaperFields() {}
}
