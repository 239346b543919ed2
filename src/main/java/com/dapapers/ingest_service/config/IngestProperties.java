package com.dapapers.ingest_service.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Import job settings (prefix {@code ingest.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {

  /** Delete the paper index before the import job recreates it. */
  private boolean recreateIndex;

  /** Records per bulk index call. */
  private int batchSize = 500;

  /** Wait after every successfully indexed page. */
  private Duration pageDelay = Duration.ofMillis(120);

  /** Log progress every this many pages; the first five pages are always logged. */
  private int progressEveryPages = 50;

  /** Longest accepted line in a dataset file, in bytes. */
  private int maxLineBytes = 32 * 1024 * 1024;

  /** Log decoder progress every this many matched records. */
  private int decoderProgressEvery = 5000;

  private final OpenAlex openalex = new OpenAlex();

  private final S2 s2 = new S2();

  private final Oai oai = new Oai();

  /** OpenAlex works export. */
  @Getter
  @Setter
  public static class OpenAlex {

    /** {@code *} starts from the beginning; paste a logged cursor to resume. */
    private String startCursor = "*";

    /** Works filter, arXiv repository source by default. */
    private String filter = "locations.source.id:S4306400194";

    private String sort = "cited_by_count:desc";

    private String select =
        "id,title,abstract_inverted_index,authorships,cited_by_count,publication_date,"
            + "publication_year,doi,locations,topics,type,open_access";

    private int perPage = 200;
  }

  /** Semantic Scholar bulk imports. */
  @Getter
  @Setter
  public static class S2 {

    /** Dataset file index (0-based) to resume from. */
    private int startFile;

    /** Keep only records carrying an arXiv id. */
    private boolean arxivOnly = true;

    /** Query of the Graph API bulk search import. */
    private String bulkQuery = "";

    /** Continuation token to resume the bulk search import from. */
    private String startToken = "";
  }

  /** arXiv OAI-PMH harvest. */
  @Getter
  @Setter
  public static class Oai {

    /** Resumption token to continue an interrupted harvest; empty starts a new list. */
    private String startToken = "";

    /** arXiv set such as {@code cs} or {@code physics:hep-th}; empty harvests everything. */
    private String set = "";

    /** Lower datestamp bound ({@code yyyy-MM-dd}) for incremental harvests. */
    private String from = "";

    private String until = "";

    private String metadataPrefix = "arXiv";

    /** arXiv asks harvesters for at most one request every three seconds. */
    private Duration requestInterval = Duration.ofSeconds(3);
  }
}
