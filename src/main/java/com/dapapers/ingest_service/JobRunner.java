package com.dapapers.ingest_service;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.driver.BulkDatasetImportDriver;
import com.dapapers.ingest_service.driver.CursorImportDriver;
import com.dapapers.ingest_service.driver.DatasetImportReport;
import com.dapapers.ingest_service.driver.ImportProgress;
import com.dapapers.ingest_service.enrich.CitationEnrichmentJob;
import com.dapapers.ingest_service.enrich.EnrichmentReport;
import com.dapapers.ingest_service.sources.arxiv.OaiPmhCursorSource;
import com.dapapers.ingest_service.sources.openalex.OpenAlexWorksCursorSource;
import com.dapapers.ingest_service.sources.semanticscholar.S2BulkSearchCursorSource;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Runs the job selected by {@code job.name} once the paper index is open. */
@Slf4j
@Service
public class JobRunner {

  private final JobName jobName;
  private final IngestProperties ingestProperties;
  private final BulkDatasetImportDriver datasetImportDriver;
  private final CursorImportDriver cursorImportDriver;
  private final OpenAlexWorksCursorSource openAlexWorksSource;
  private final S2BulkSearchCursorSource s2BulkSearchSource;
  private final OaiPmhCursorSource oaiSource;
  private final CitationEnrichmentJob enrichmentJob;

  public JobRunner(
      @Value("${job.name:none}") String jobName,
      IngestProperties ingestProperties,
      BulkDatasetImportDriver datasetImportDriver,
      CursorImportDriver cursorImportDriver,
      OpenAlexWorksCursorSource openAlexWorksSource,
      S2BulkSearchCursorSource s2BulkSearchSource,
      OaiPmhCursorSource oaiSource,
      CitationEnrichmentJob enrichmentJob) {
    this.jobName = JobName.fromProperty(jobName);
    this.ingestProperties = ingestProperties;
    this.datasetImportDriver = datasetImportDriver;
    this.cursorImportDriver = cursorImportDriver;
    this.openAlexWorksSource = openAlexWorksSource;
    this.s2BulkSearchSource = s2BulkSearchSource;
    this.oaiSource = oaiSource;
    this.enrichmentJob = enrichmentJob;
  }

  public JobName getJobName() {
    return jobName;
  }

  /** Import jobs are the ones that honour {@code ingest.recreate-index}. */
  public boolean isImportJob() {
    return jobName == JobName.S2_IMPORT
        || jobName == JobName.OPENALEX_IMPORT
        || jobName == JobName.S2_BULK_SEARCH_IMPORT
        || jobName == JobName.ARXIV_OAI_IMPORT;
  }

  public void run() throws ApiFetchException, IOException {
    switch (jobName) {
      case NONE -> log.info("No job configured (job.name=none)");
      case S2_IMPORT -> {
        DatasetImportReport report =
            datasetImportDriver.run(ingestProperties.getS2().getStartFile());
        log.info("S2 dataset import: {}", report);
      }
      case OPENALEX_IMPORT -> {
        ImportProgress progress =
            cursorImportDriver.run(
                openAlexWorksSource, ingestProperties.getOpenalex().getStartCursor());
        logCursorOutcome(progress, "ingest.openalex.start-cursor");
      }
      case S2_BULK_SEARCH_IMPORT -> {
        ImportProgress progress =
            cursorImportDriver.run(s2BulkSearchSource, ingestProperties.getS2().getStartToken());
        logCursorOutcome(progress, "ingest.s2.start-token");
      }
      case ARXIV_OAI_IMPORT -> {
        ImportProgress progress =
            cursorImportDriver.run(oaiSource, ingestProperties.getOai().getStartToken());
        logCursorOutcome(progress, "ingest.oai.start-token");
        oaiSource
            .getLatestDatestamp()
            .ifPresent(
                datestamp -> log.info("Next incremental harvest: ingest.oai.from={}", datestamp));
      }
      case ENRICH -> {
        EnrichmentReport report = enrichmentJob.run();
        log.info("Citation enrichment: {}", report);
      }
    }
  }

  private static void logCursorOutcome(ImportProgress progress, String resumeProperty) {
    if (progress.isFinished()) {
      log.info("Import complete: {}", progress);
    } else {
      log.warn(
          "Import {} ({}); resume with {}={}",
          progress.getState(),
          progress.getMessage(),
          resumeProperty,
          progress.getResumeCursor());
    }
  }
}
