package com.dapapers.ingest_service.sources.openalex;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/** OpenAlex work, as returned by {@code /works}. Only the selected fields are populated. */
@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OpenAlexWork {

  public static final String ID_PREFIX = "https://openalex.org/";

  private String id;
  private String doi;
  private String title;
  private String displayName;
  private Integer publicationYear;
  private String publicationDate;
  private String type;
  private Integer citedByCount;
  private List<Authorship> authorships = new ArrayList<>();
  private List<Location> locations = new ArrayList<>();
  private Location primaryLocation;
  private List<Topic> topics = new ArrayList<>();
  private OpenAccess openAccess;
  private Map<String, Object> ids = new LinkedHashMap<>();
  private Map<String, List<Integer>> abstractInvertedIndex;

  /** {@code W2741809807} for {@code https://openalex.org/W2741809807}. */
  public String shortId() {
    if (id == null) {
      return null;
    }
    return id.startsWith(ID_PREFIX) ? id.substring(ID_PREFIX.length()) : id;
  }

  /** Numeric part of the work id, used as document id. */
  public String workNumber() {
    String shortId = shortId();
    if (shortId == null) {
      return null;
    }
    return shortId.startsWith("W") ? shortId.substring(1) : shortId;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Authorship {
    private String authorPosition;
    private Author author;
    private List<Institution> institutions = new ArrayList<>();
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Author {
    private String id;
    private String displayName;
    private String orcid;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Institution {
    private String displayName;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Location {
    private Boolean isOa;
    private String landingPageUrl;
    private String pdfUrl;
    private Source source;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Source {
    private String id;
    private String displayName;
    private String type;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Topic {
    private String displayName;
    private Double score;
    private NamedEntity subfield;
    private NamedEntity field;
    private NamedEntity domain;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class NamedEntity {
    private String displayName;
  }

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class OpenAccess {
    private Boolean isOa;
    private String oaStatus;
    private String oaUrl;
  }
}
