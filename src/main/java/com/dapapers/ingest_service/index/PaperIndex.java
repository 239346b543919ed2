package com.dapapers.ingest_service.index;

import com.dapapers.ingest_service.model.PaperRecord;
import com.dapapers.ingest_service.model.PaperSource;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Bulk search index of paper records. Writes are keyed on {@link PaperRecord#id()}, so writing a
 * record twice leaves one document.
 */
public interface PaperIndex {

  /** Creates the index if it does not exist yet. Calling it again is a no-op. */
  void createIndexIfAbsent() throws IOException;

  /** Deletes the index. Deleting an index that does not exist succeeds. */
  void deleteIndex() throws IOException;

  long getDocumentCount() throws IOException;

  /**
   * Writes a batch of records. Records that cannot be written (not indexable, rejected by the
   * index) are counted in {@link BulkIndexResult#errors()}; they never fail the batch.
   *
   * @throws IOException when the batch as a whole could not be written
   */
  BulkIndexResult bulkIndex(List<PaperRecord> papers) throws IOException;

  Optional<PaperRecord> findById(String id) throws IOException;

  Optional<PaperRecord> findByExternalId(PaperSource source, String externalId) throws IOException;
}
