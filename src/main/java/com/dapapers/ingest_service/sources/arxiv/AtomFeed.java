package com.dapapers.ingest_service.sources.arxiv;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * arXiv API Atom response. Namespaced elements ({@code opensearch:totalResults}, {@code
 * arxiv:affiliation}) bind by local name.
 */
@Getter
@Setter
@JacksonXmlRootElement(localName = "feed")
public class AtomFeed {

  @JacksonXmlProperty(localName = "totalResults")
  private long totalResults;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "entry")
  private List<Entry> entries = new ArrayList<>();

  @Getter
  @Setter
  public static class Entry {
    private String id;
    private String title;
    private String summary;
    private String published;
    private String updated;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "author")
    private List<AtomAuthor> authors = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "link")
    private List<Link> links = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "category")
    private List<Category> categories = new ArrayList<>();

    @JacksonXmlProperty(localName = "primary_category")
    private Category primaryCategory;

    private String doi;

    @JacksonXmlProperty(localName = "journal_ref")
    private String journalRef;
  }

  @Getter
  @Setter
  public static class AtomAuthor {
    private String name;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "affiliation")
    private List<String> affiliations = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Link {
    @JacksonXmlProperty(isAttribute = true)
    private String href;

    @JacksonXmlProperty(isAttribute = true)
    private String rel;

    @JacksonXmlProperty(isAttribute = true)
    private String type;

    @JacksonXmlProperty(isAttribute = true)
    private String title;
  }

  @Getter
  @Setter
  public static class Category {
    @JacksonXmlProperty(isAttribute = true)
    private String term;

    @JacksonXmlProperty(isAttribute = true)
    private String scheme;
  }
}
