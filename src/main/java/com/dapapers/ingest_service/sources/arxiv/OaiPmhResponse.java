package com.dapapers.ingest_service.sources.arxiv;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/** OAI-PMH v2.0 {@code ListRecords} response carrying arXiv-format metadata. */
@Getter
@Setter
@JacksonXmlRootElement(localName = "OAI-PMH")
public class OaiPmhResponse {

  private String responseDate;

  @JacksonXmlProperty(localName = "error")
  private OaiError error;

  @JacksonXmlProperty(localName = "ListRecords")
  private ListRecords listRecords;

  @Getter
  @Setter
  public static class OaiError {
    @JacksonXmlProperty(localName = "code", isAttribute = true)
    private String code;

    @JacksonXmlText
    private String message;
  }

  @Getter
  @Setter
  public static class ListRecords {
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "record")
    private List<OaiRecord> records = new ArrayList<>();

    private ResumptionToken resumptionToken;
  }

  /** Empty token text marks the last page of a list. */
  @Getter
  @Setter
  public static class ResumptionToken {
    @JacksonXmlProperty(localName = "completeListSize", isAttribute = true)
    private String completeListSize;

    @JacksonXmlProperty(localName = "cursor", isAttribute = true)
    private String cursor;

    @JacksonXmlText
    private String token;
  }

  @Getter
  @Setter
  public static class OaiRecord {
    private Header header;
    private Metadata metadata;
  }

  @Getter
  @Setter
  public static class Header {
    /** {@code deleted} for withdrawn records, which carry no metadata. */
    @JacksonXmlProperty(localName = "status", isAttribute = true)
    private String status;

    private String identifier;
    private String datestamp;

    @JacksonXmlElementWrapper(useWrapping = false)
    private List<String> setSpec = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Metadata {
    @JacksonXmlProperty(localName = "arXiv")
    private ArxivMetadata arxiv;
  }

  @Getter
  @Setter
  public static class ArxivMetadata {
    private String id;
    private String created;
    private String updated;

    @JacksonXmlElementWrapper(localName = "authors")
    @JacksonXmlProperty(localName = "author")
    private List<ArxivAuthor> authors = new ArrayList<>();

    private String title;

    /** Space separated, primary category first. */
    private String categories;

    private String comments;

    @JacksonXmlProperty(localName = "journal-ref")
    private String journalRef;

    private String doi;
    private String license;

    @JacksonXmlProperty(localName = "abstract")
    private String abstractText;
  }

  @Getter
  @Setter
  public static class ArxivAuthor {
    private String keyname;
    private String forenames;
    private String suffix;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "affiliation")
    private List<String> affiliations = new ArrayList<>();
  }
}
