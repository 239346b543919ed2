package com.dapapers.ingest_service.sources.openalex;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/** One {@code /works} response page, paged either by {@code page} or by {@code cursor}. */
@Getter
@Setter
public class OpenAlexWorksPage {

  private Meta meta = new Meta();
  private List<OpenAlexWork> results = new ArrayList<>();

  @Getter
  @Setter
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Meta {
    private long count;
    private Integer page;
    private Integer perPage;
    private String nextCursor;
  }
}
