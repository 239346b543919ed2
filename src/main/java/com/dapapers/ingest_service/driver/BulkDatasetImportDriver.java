package com.dapapers.ingest_service.driver;

import com.dapapers.ingest_service.client.ApiFetchException;
import com.dapapers.ingest_service.config.IngestProperties;
import com.dapapers.ingest_service.index.BulkIndexResult;
import com.dapapers.ingest_service.index.PaperIndex;
import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.sources.semanticscholar.S2DatasetsAdapter;
import com.dapapers.ingest_service.sources.semanticscholar.S2Paper;
import com.dapapers.ingest_service.sources.semanticscholar.S2PaperConverter;
import com.dapapers.ingest_service.streaming.DecodeResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Imports the Semantic Scholar {@code papers} dataset file by file.
 *
 * <p>A failing file is logged with its index and counted; the import goes on with the next file.
 * Rerunning with {@code ingest.s2.start-file} set to a logged index resumes from that file.
 */
@Slf4j
@Component
public class BulkDatasetImportDriver {

  private final S2DatasetsAdapter datasetsAdapter;
  private final PaperIndex paperIndex;
  private final int batchSize;

  public BulkDatasetImportDriver(
      S2DatasetsAdapter datasetsAdapter, PaperIndex paperIndex, IngestProperties properties) {
    this.datasetsAdapter = datasetsAdapter;
    this.paperIndex = paperIndex;
    this.batchSize = Math.max(1, properties.getBatchSize());
  }

  /**
   * @param startFile 0-based index of the first file to import
   * @throws ApiFetchException if the dataset manifest cannot be fetched
   */
  public DatasetImportReport run(int startFile) throws ApiFetchException {
    List<String> files = datasetsAdapter.latestDatasetFiles();
    DatasetImportReport report = new DatasetImportReport();
    report.filesListed(files.size());
    int first = Math.max(0, startFile);
    if (first > 0) {
      log.info("Skipping the first {} of {} files", first, files.size());
    }

    for (int i = first; i < files.size(); i++) {
      log.info("Importing file {}/{} (index {})", i + 1, files.size(), i);
      try {
        DecodeResult result =
            datasetsAdapter.streamFile(
                files.get(i),
                batchSize,
                datasetsAdapter.defaultFilter(),
                batch -> indexBatch(batch, report));
        report.fileDecoded(result);
        if (!result.isComplete()) {
          report.fileFailed(i);
          log.error(
              "File {} stopped after {} records; rerun with ingest.s2.start-file={}",
              i,
              result.matched(),
              i,
              result.failure());
        } else {
          log.info(
              "File {} done: {} matched of {} lines, {} malformed, {} oversized",
              i,
              result.matched(),
              result.scanned(),
              result.malformed(),
              result.oversized());
        }
      } catch (ApiFetchException e) {
        report.fileFailed(i);
        log.error("File {} could not be downloaded; rerun with ingest.s2.start-file={}", i, i, e);
      }
    }

    log.info("Dataset import finished: {}", report);
    return report;
  }

  private void indexBatch(List<S2Paper> batch, DatasetImportReport report) throws IOException {
    List<PaperRecord> records = new ArrayList<>(batch.size());
    for (S2Paper paper : batch) {
      Optional<PaperRecord> record = S2PaperConverter.fromDataset(paper);
      record.ifPresent(records::add);
    }
    BulkIndexResult result = paperIndex.bulkIndex(records);
    report.batchIndexed(
        records.size(), batch.size() - records.size(), result.accepted(), result.errors());
  }
}
