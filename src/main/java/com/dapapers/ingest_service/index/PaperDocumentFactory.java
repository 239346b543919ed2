package com.dapapers.ingest_service.index;

import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Component;

/**
 * Converts {@link PaperRecord}s to Lucene documents and back.
 *
 * <p>Keyword fields use {@link StringField}, free text {@link TextField}. The citation count is a
 * doc-values-only field so that it can be updated without re-indexing the document; reading it
 * back needs the doc values of the hit, see {@link LucenePaperIndex}.
 */
@Slf4j
@Component
public class PaperDocumentFactory {

  private static final TypeReference<List<Author>> AUTHOR_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public PaperDocumentFactory(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Document create(PaperRecord paper) {
    Document doc = new Document();
    doc.add(new StringField(PaperFields.ID, paper.id(), Field.Store.YES));
    doc.add(new StringField(PaperFields.EXTERNAL_ID, paper.externalId(), Field.Store.YES));
    doc.add(new SortedDocValuesField(PaperFields.EXTERNAL_ID, new BytesRef(paper.externalId())));
    doc.add(new StringField(PaperFields.SOURCE, paper.source().getTag(), Field.Store.YES));
    doc.add(new TextField(PaperFields.TITLE, paper.title(), Field.Store.YES));
    addText(doc, PaperFields.ABSTRACT, paper.abstractText());
    addText(doc, PaperFields.TLDR, paper.tldr());

    doc.add(new StoredField(PaperFields.AUTHORS, writeAuthors(paper.authors())));
    for (String name : paper.authorNames()) {
      doc.add(new TextField(PaperFields.AUTHOR_NAMES, name, Field.Store.NO));
    }

    if (paper.publishedDate() != null) {
      doc.add(
          new StringField(
              PaperFields.PUBLISHED_DATE, paper.publishedDate().toString(), Field.Store.YES));
    }
    if (paper.year() != null && paper.year() > 0) {
      doc.add(new IntPoint(PaperFields.YEAR, paper.year()));
      doc.add(new StoredField(PaperFields.YEAR, paper.year()));
    }

    addStoredOnly(doc, PaperFields.PDF_URL, paper.pdfUrl());
    addKeyword(doc, PaperFields.PRIMARY_CATEGORY, paper.primaryCategory());
    for (String category : paper.categories()) {
      doc.add(new StringField(PaperFields.CATEGORIES, category, Field.Store.YES));
    }
    addKeyword(doc, PaperFields.DOI, paper.doi());
    addText(doc, PaperFields.JOURNAL, paper.journal());
    if (hasText(paper.venue())) {
      doc.add(new StringField(PaperFields.VENUE, paper.venue(), Field.Store.YES));
      doc.add(new TextField(PaperFields.VENUE_TEXT, paper.venue(), Field.Store.NO));
    }

    doc.add(new NumericDocValuesField(PaperFields.CITATION_COUNT, paper.citationCount()));
    addCount(doc, PaperFields.REFERENCE_COUNT, paper.referenceCount());
    addCount(doc, PaperFields.INFLUENTIAL_CITATION_COUNT, paper.influentialCitationCount());

    doc.add(
        new StringField(
            PaperFields.IS_OPEN_ACCESS, Boolean.toString(paper.openAccess()), Field.Store.YES));
    for (String type : paper.publicationTypes()) {
      doc.add(new StringField(PaperFields.PUBLICATION_TYPES, type, Field.Store.YES));
    }
    addStoredOnly(doc, PaperFields.SOURCE_URL, paper.sourceUrl());
    addStoredOnly(doc, PaperFields.HTML_URL, paper.htmlUrl());
    addKeyword(doc, PaperFields.PMC_ID, paper.pmcId());
    return doc;
  }

  /**
   * Rebuilds a record from stored fields.
   *
   * @param citationCount value read from the {@link PaperFields#CITATION_COUNT} doc values
   */
  public PaperRecord read(Document doc, long citationCount) {
    IndexableField year = doc.getField(PaperFields.YEAR);
    IndexableField refs = doc.getField(PaperFields.REFERENCE_COUNT);
    IndexableField influential = doc.getField(PaperFields.INFLUENTIAL_CITATION_COUNT);
    return PaperRecord.builder()
        .id(doc.get(PaperFields.ID))
        .externalId(doc.get(PaperFields.EXTERNAL_ID))
        .source(PaperSource.fromTag(doc.get(PaperFields.SOURCE)).orElse(null))
        .title(doc.get(PaperFields.TITLE))
        .abstractText(doc.get(PaperFields.ABSTRACT))
        .tldr(doc.get(PaperFields.TLDR))
        .authors(readAuthors(doc.get(PaperFields.AUTHORS)))
        .publishedDate(parseDate(doc.get(PaperFields.PUBLISHED_DATE)))
        .year(year == null ? null : year.numericValue().intValue())
        .pdfUrl(doc.get(PaperFields.PDF_URL))
        .categories(List.of(doc.getValues(PaperFields.CATEGORIES)))
        .doi(doc.get(PaperFields.DOI))
        .journal(doc.get(PaperFields.JOURNAL))
        .venue(doc.get(PaperFields.VENUE))
        .citationCount((int) citationCount)
        .referenceCount(refs == null ? 0 : refs.numericValue().intValue())
        .influentialCitationCount(influential == null ? 0 : influential.numericValue().intValue())
        .openAccess(Boolean.parseBoolean(doc.get(PaperFields.IS_OPEN_ACCESS)))
        .publicationTypes(List.of(doc.getValues(PaperFields.PUBLICATION_TYPES)))
        .sourceUrl(doc.get(PaperFields.SOURCE_URL))
        .htmlUrl(doc.get(PaperFields.HTML_URL))
        .pmcId(doc.get(PaperFields.PMC_ID))
        .build();
  }

  private String writeAuthors(List<Author> authors) {
    try {
      return objectMapper.writeValueAsString(authors);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize authors", e);
    }
  }

  private List<Author> readAuthors(String json) {
    if (!hasText(json)) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, AUTHOR_LIST);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable stored authors: {}", e.getMessage());
      return List.of();
    }
  }

  private static LocalDate parseDate(String value) {
    if (!hasText(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static void addKeyword(Document doc, String field, String value) {
    if (hasText(value)) {
      doc.add(new StringField(field, value, Field.Store.YES));
    }
  }

  private static void addText(Document doc, String field, String value) {
    if (hasText(value)) {
      doc.add(new TextField(field, value, Field.Store.YES));
    }
  }

  private static void addStoredOnly(Document doc, String field, String value) {
    if (hasText(value)) {
      doc.add(new StoredField(field, value));
    }
  }

  private static void addCount(Document doc, String field, int value) {
    doc.add(new StoredField(field, value));
    doc.add(new NumericDocValuesField(field, value));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
