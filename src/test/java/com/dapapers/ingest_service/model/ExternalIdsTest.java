package com.dapapers.ingest_service.model;

import static org.junit.jupiter.api.Assertions.*;

import com.dapapers.ingest_service.sources.Mappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExternalIdsTest {

  private final ObjectMapper mapper = Mappers.json();

  @Test
  void fromJson_keysCaseInsensitive() throws Exception {
    ExternalIds ids =
        mapper.readValue("{\"ArXiv\":\"1706.03762\",\"DOI\":\"10.1/x\"}", ExternalIds.class);

    assertEquals(Optional.of("1706.03762"), ids.arxiv());
    assertEquals(Optional.of("10.1/x"), ids.get("doi"));
  }

  @Test
  void fromJson_numbersRenderedWithoutExponent() throws Exception {
    ExternalIds ids =
        mapper.readValue("{\"CorpusId\":215000000,\"PubMed\":2.15E8}", ExternalIds.class);

    assertEquals(Optional.of("215000000"), ids.corpusId());
    assertEquals(Optional.of("215000000"), ids.pubmed());
  }

  @Test
  void fromJson_nullsAndBlanksDropped() throws Exception {
    ExternalIds ids =
        mapper.readValue("{\"ArXiv\":null,\"DOI\":\"  \",\"MAG\":[1,2]}", ExternalIds.class);

    assertTrue(ids.isEmpty());
  }

  @Test
  void pmcid_prefersPubMedCentralKey() {
    assertEquals(
        Optional.of("6907074"),
        ExternalIds.fromJson(Map.of("PubMedCentral", "6907074")).pmcid());
  }
}
