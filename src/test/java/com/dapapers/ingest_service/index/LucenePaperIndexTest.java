package com.dapapers.ingest_service.index;

import static org.junit.jupiter.api.Assertions.*;

import com.dapapers.ingest_service.model.Author;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LucenePaperIndexTest {

  @TempDir Path tempDir;

  private LuceneTestIndex index;
  private LucenePaperIndex paperIndex;

  @BeforeEach
  void setUp() throws IOException {
    index = new LuceneTestIndex(tempDir);
    paperIndex = index.paperIndex;
    paperIndex.createIndexIfAbsent();
  }

  @AfterEach
  void tearDown() {
    index.close();
  }

  @Test
  void createIndexIfAbsent_calledTwice_noOp() throws IOException {
    paperIndex.bulkIndex(List.of(LuceneTestIndex.arxivPaper("1706.03762", 1)));

    paperIndex.createIndexIfAbsent();

    assertEquals(1, paperIndex.getDocumentCount());
    assertTrue(Files.isDirectory(tempDir.resolve(IndexName.PAPERS.getIndexName())));
  }

  @Test
  void bulkIndex_sameBatchTwice_oneDocumentPerId() throws IOException {
    List<PaperRecord> batch =
        List.of(
            LuceneTestIndex.arxivPaper("1706.03762", 10),
            LuceneTestIndex.arxivPaper("1810.04805", 20));

    paperIndex.bulkIndex(batch);
    BulkIndexResult second = paperIndex.bulkIndex(batch);

    assertEquals(new BulkIndexResult(2, 2), second);
    assertEquals(2, paperIndex.getDocumentCount());
  }

  @Test
  void bulkIndex_reimportOverwritesStoredFields() throws IOException {
    paperIndex.bulkIndex(List.of(LuceneTestIndex.arxivPaper("1706.03762", 10)));
    PaperRecord updated =
        LuceneTestIndex.arxivPaper("1706.03762", 99).toBuilder().title("Renamed").build();

    paperIndex.bulkIndex(List.of(updated));

    PaperRecord stored = paperIndex.findById("1706.03762").orElseThrow();
    assertEquals("Renamed", stored.title());
    assertEquals(99, stored.citationCount());
  }

  @Test
  void bulkIndex_rejectedDocument_countedAndRestWritten() throws IOException {
    PaperRecord immenseDoi =
        LuceneTestIndex.arxivPaper("2301.00002", 0).toBuilder()
            .doi("10.1000/" + "x".repeat(40_000))
            .build();
    PaperRecord untitled = LuceneTestIndex.arxivPaper("2301.00003", 0).toBuilder().title("").build();

    BulkIndexResult result =
        paperIndex.bulkIndex(
            List.of(
                LuceneTestIndex.arxivPaper("2301.00001", 0),
                immenseDoi,
                untitled,
                LuceneTestIndex.arxivPaper("2301.00004", 0)));

    assertEquals(4, result.submitted());
    assertEquals(2, result.accepted());
    assertEquals(2, result.errors());
    assertEquals(2, paperIndex.getDocumentCount());
    assertTrue(paperIndex.findById("2301.00002").isEmpty());
  }

  @Test
  void bulkIndex_emptyBatch_nothingSubmitted() throws IOException {
    assertEquals(BulkIndexResult.EMPTY, paperIndex.bulkIndex(List.of()));
  }

  @Test
  void findById_storedRecordReadBack() throws IOException {
    PaperRecord paper =
        PaperRecord.builder()
            .id("13756489")
            .externalId("1706.03762")
            .source(PaperSource.ARXIV)
            .title("Attention Is All You Need")
            .abstractText("The dominant sequence transduction models")
            .author(new Author("Ashish Vaswani", "Google Brain", "40348417"))
            .author(Author.of("Noam Shazeer"))
            .publishedDate(LocalDate.of(2017, 6, 12))
            .categories(List.of("cs.CL", "cs.LG"))
            .doi("10.48550/arXiv.1706.03762")
            .venue("NeurIPS")
            .citationCount(105_000)
            .referenceCount(41)
            .openAccess(true)
            .publicationTypes(List.of("JournalArticle"))
            .pdfUrl("https://arxiv.org/pdf/1706.03762")
            .build();

    paperIndex.bulkIndex(List.of(paper));

    assertEquals(paper, paperIndex.findById("13756489").orElseThrow());
  }

  @Test
  void findByExternalId_matchesSourceAndExternalId() throws IOException {
    PaperRecord pubmed =
        PaperRecord.builder()
            .id("31452104")
            .externalId("31452104")
            .source(PaperSource.PUBMED)
            .title("Search-and-replace genome editing")
            .build();
    paperIndex.bulkIndex(List.of(pubmed, LuceneTestIndex.arxivPaper("1706.03762", 0)));

    assertEquals(
        "31452104",
        paperIndex.findByExternalId(PaperSource.PUBMED, "31452104").orElseThrow().id());
    assertTrue(paperIndex.findByExternalId(PaperSource.ARXIV, "31452104").isEmpty());
  }

  @Test
  void deleteIndex_thenCreate_startsEmpty() throws IOException {
    paperIndex.bulkIndex(List.of(LuceneTestIndex.arxivPaper("1706.03762", 0)));

    paperIndex.deleteIndex();
    assertFalse(Files.exists(tempDir.resolve(IndexName.PAPERS.getIndexName())));
    paperIndex.createIndexIfAbsent();

    assertEquals(0, paperIndex.getDocumentCount());
  }

  @Test
  void deleteIndex_absent_succeeds() throws IOException {
    paperIndex.deleteIndex();

    assertDoesNotThrow(() -> paperIndex.deleteIndex());
  }
}
