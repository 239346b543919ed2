package com.dapapers.ingest_service.sources.semanticscholar;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Graph API search page. Relevance search pages with {@code offset}; bulk search continues with
 * {@code token}, which is absent on the last page.
 */
@Getter
@Setter
public class S2SearchResponse {
  private long total;
  private Integer offset;
  private Integer next;
  private String token;
  private List<S2Paper> data = new ArrayList<>();
}
