package com.dapapers.ingest_service;

import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.index.PaperIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Opens the paper index once the application is ready, then runs the configured job.
 *
 * <p>With {@code ingest.recreate-index=true} an import job starts from an empty index.
 */
@Slf4j
@Service
public class InitializationService {

  private final PaperIndex paperIndex;
  private final IngestProperties ingestProperties;
  private final JobRunner jobRunner;

  public InitializationService(
      PaperIndex paperIndex, IngestProperties ingestProperties, JobRunner jobRunner) {
    this.paperIndex = paperIndex;
    this.ingestProperties = ingestProperties;
    this.jobRunner = jobRunner;
  }

  /**
   * @throws IllegalStateException if the index cannot be opened or the job fails
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.debug("Application initialization started");
    try {
      if (ingestProperties.isRecreateIndex() && jobRunner.isImportJob()) {
        log.info("Recreating paper index");
        paperIndex.deleteIndex();
      }
      paperIndex.createIndexIfAbsent();
      log.info("Paper index ready with {} documents", paperIndex.getDocumentCount());

      jobRunner.run();
      log.info("Job {} completed", jobRunner.getJobName().getPropertyValue());
    } catch (Exception e) {
      log.error("Application initialization failed", e);
      throw new IllegalStateException("Failed to initialize application components", e);
    }
  }
}
