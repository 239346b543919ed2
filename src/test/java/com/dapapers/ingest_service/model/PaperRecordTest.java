package com.dapapers.ingest_service.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PaperRecordTest {

  private static PaperRecord.PaperRecordBuilder minimal() {
    return PaperRecord.builder()
        .id("1706.03762")
        .externalId("1706.03762")
        .source(PaperSource.ARXIV)
        .title("Attention Is All You Need");
  }

  @Test
  void categories_duplicatesRemovedInFirstSeenOrder() {
    PaperRecord paper =
        minimal().categories(Arrays.asList("cs.CL", "cs.LG", "cs.CL", " ", null, "stat.ML")).build();

    assertEquals(List.of("cs.CL", "cs.LG", "stat.ML"), paper.categories());
    assertEquals("cs.CL", paper.primaryCategory());
  }

  @Test
  void counts_negativeValuesClampedToZero() {
    PaperRecord paper = minimal().citationCount(-1).referenceCount(-5).build();

    assertEquals(0, paper.citationCount());
    assertEquals(0, paper.referenceCount());
  }

  @Test
  void doi_resolverPrefixStripped() {
    assertEquals("10.1000/xyz", minimal().doi("https://doi.org/10.1000/xyz").build().doi());
    assertEquals("10.1000/xyz", minimal().doi("doi:10.1000/xyz").build().doi());
    assertNull(minimal().doi("  ").build().doi());
  }

  @Test
  void year_derivedFromPublishedDate() {
    assertEquals(2017, minimal().publishedDate(LocalDate.of(2017, 6, 12)).build().year());
  }

  @Test
  void isIndexable_requiresTitleAndExternalId() {
    assertTrue(minimal().build().isIndexable());
    assertFalse(minimal().title("   ").build().isIndexable());
    assertFalse(minimal().externalId("").build().isIndexable());
    assertFalse(minimal().source(null).build().isIndexable());
  }

  @Test
  void author_builderAppendsInOrder() {
    PaperRecord paper =
        minimal().author(Author.of("Ashish Vaswani")).author(Author.of("  ")).build();

    assertEquals(List.of("Ashish Vaswani"), paper.authorNames());
    assertEquals(2, paper.authors().size());
  }
}
