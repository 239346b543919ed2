package com.dapapers.ingest_service.sources.pubmed;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/** E-utilities EFetch response ({@code rettype=abstract}, {@code retmode=xml}). */
@Getter
@Setter
@JacksonXmlRootElement(localName = "PubmedArticleSet")
public class PubmedArticleSet {

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "PubmedArticle")
  private List<PubmedArticle> articles = new ArrayList<>();

  @Getter
  @Setter
  public static class PubmedArticle {
    @JacksonXmlProperty(localName = "MedlineCitation")
    private MedlineCitation medlineCitation;

    @JacksonXmlProperty(localName = "PubmedData")
    private PubmedData pubmedData;
  }

  @Getter
  @Setter
  public static class MedlineCitation {
    @JacksonXmlProperty(localName = "PMID")
    private TextValue pmid;

    @JacksonXmlProperty(localName = "Article")
    private Article article;
  }

  @Getter
  @Setter
  public static class Article {
    @JacksonXmlProperty(localName = "Journal")
    private Journal journal;

    @JacksonXmlProperty(localName = "ArticleTitle")
    @JsonDeserialize(using = MixedText.Deserializer.class)
    private String articleTitle;

    @JacksonXmlProperty(localName = "Abstract")
    private Abstract abstractSection;

    @JacksonXmlElementWrapper(localName = "AuthorList")
    @JacksonXmlProperty(localName = "Author")
    private List<PubmedAuthor> authors = new ArrayList<>();

    @JacksonXmlElementWrapper(localName = "PublicationTypeList")
    @JacksonXmlProperty(localName = "PublicationType")
    private List<TextValue> publicationTypes = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Journal {
    @JacksonXmlProperty(localName = "Title")
    private String title;

    @JacksonXmlProperty(localName = "JournalIssue")
    private JournalIssue journalIssue;
  }

  @Getter
  @Setter
  public static class JournalIssue {
    @JacksonXmlProperty(localName = "PubDate")
    private PubDate pubDate;
  }

  @Getter
  @Setter
  public static class PubDate {
    @JacksonXmlProperty(localName = "Year")
    private String year;

    @JacksonXmlProperty(localName = "Month")
    private String month;

    @JacksonXmlProperty(localName = "Day")
    private String day;

    @JacksonXmlProperty(localName = "MedlineDate")
    private String medlineDate;
  }

  @Getter
  @Setter
  public static class Abstract {
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "AbstractText")
    private List<AbstractText> texts = new ArrayList<>();
  }

  @Getter
  @Setter
  @JsonDeserialize(using = AbstractTextDeserializer.class)
  public static class AbstractText {
    private String label;
    private String text;
  }

  static class AbstractTextDeserializer extends JsonDeserializer<AbstractText> {
    private static final Set<String> ATTRIBUTES = Set.of("Label", "NlmCategory");

    @Override
    public AbstractText deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      AbstractText section = new AbstractText();
      section.setText(
          MixedText.read(
              parser,
              ATTRIBUTES,
              (name, value) -> {
                if ("Label".equals(name)) {
                  section.setLabel(value);
                }
              }));
      return section;
    }
  }

  @Getter
  @Setter
  public static class PubmedAuthor {
    @JacksonXmlProperty(localName = "LastName")
    private String lastName;

    @JacksonXmlProperty(localName = "ForeName")
    private String foreName;

    @JacksonXmlProperty(localName = "CollectiveName")
    private String collectiveName;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "AffiliationInfo")
    private List<AffiliationInfo> affiliationInfo = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class AffiliationInfo {
    @JacksonXmlProperty(localName = "Affiliation")
    private String affiliation;
  }

  @Getter
  @Setter
  public static class PubmedData {
    @JacksonXmlElementWrapper(localName = "ArticleIdList")
    @JacksonXmlProperty(localName = "ArticleId")
    private List<ArticleId> articleIds = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class ArticleId {
    @JacksonXmlProperty(localName = "IdType", isAttribute = true)
    private String idType;

    @JacksonXmlText
    private String value;
  }

  /** Element whose attributes are ignored and only the text matters. */
  @Getter
  @Setter
  public static class TextValue {
    @JacksonXmlText
    private String value;
  }
}
