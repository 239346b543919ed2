package com.dapapers.ingest_service.sources.semanticscholar;

import com.dapapers.ingest_service.model.ExternalIds;
import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Semantic Scholar paper. The Graph API uses camelCase keys and the bulk datasets all-lowercase
 * keys; both bind to this class.
 */
@Getter
@Setter
public class S2Paper {

  private String paperId;

  @JsonAlias("corpusid")
  private Long corpusId;

  @JsonAlias("externalids")
  private ExternalIds externalIds = ExternalIds.empty();

  private String url;
  private String title;

  @JsonAlias("abstract")
  private String abstractText;

  private String venue;
  private Integer year;

  @JsonAlias("referencecount")
  private Integer referenceCount;

  @JsonAlias("citationcount")
  private Integer citationCount;

  @JsonAlias("influentialcitationcount")
  private Integer influentialCitationCount;

  @JsonAlias("isopenaccess")
  private Boolean isOpenAccess;

  private OpenAccessPdf openAccessPdf;

  @JsonAlias("s2fieldsofstudy")
  private List<FieldOfStudy> s2FieldsOfStudy = new ArrayList<>();

  @JsonAlias("fieldsofstudy")
  private List<String> fieldsOfStudy = new ArrayList<>();

  @JsonAlias("publicationtypes")
  private List<String> publicationTypes = new ArrayList<>();

  @JsonAlias("publicationdate")
  private String publicationDate;

  private Journal journal;
  private List<S2Author> authors = new ArrayList<>();
  private Tldr tldr;

  public ExternalIds externalIdsOrEmpty() {
    return externalIds == null ? ExternalIds.empty() : externalIds;
  }

  @Getter
  @Setter
  public static class OpenAccessPdf {
    private String url;
    private String status;
  }

  @Getter
  @Setter
  public static class FieldOfStudy {
    private String category;
    private String source;
  }

  @Getter
  @Setter
  public static class Journal {
    private String name;
    private String volume;
    private String pages;
  }

  @Getter
  @Setter
  public static class S2Author {
    @JsonAlias("authorid")
    private String authorId;

    private String name;
  }

  @Getter
  @Setter
  public static class Tldr {
    private String model;
    private String text;
  }
}
