package com.dapapers.ingest_service.sources.pubmed;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/** E-utilities ESearch response: hit count and one page of PMIDs. */
@Getter
@Setter
@JacksonXmlRootElement(localName = "eSearchResult")
public class ESearchResult {

  @JacksonXmlProperty(localName = "Count")
  private long count;

  @JacksonXmlElementWrapper(localName = "IdList")
  @JacksonXmlProperty(localName = "Id")
  private List<String> ids = new ArrayList<>();
}
