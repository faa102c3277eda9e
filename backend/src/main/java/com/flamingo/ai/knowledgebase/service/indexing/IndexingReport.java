package com.flamingo.ai.knowledgebase.service.indexing;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Summary of an indexing run.
 *
 * @param message failure or cancellation reason, {@code null} on success
 */
public record IndexingReport(
    IndexingOutcome outcome,
    List<String> indexedDocumentIds,
    List<SkippedFile> skippedFiles,
    int chunkCount,
    Duration elapsed,
    String message) {

  public IndexingReport {
    indexedDocumentIds = List.copyOf(indexedDocumentIds);
    skippedFiles = List.copyOf(skippedFiles);
  }

  public boolean isSuccess() {
    return outcome == IndexingOutcome.SUCCEEDED;
  }

  /** A file that could not be read and was left out of the index. */
  public record SkippedFile(Path path, String errorCode, String reason) {}
}
