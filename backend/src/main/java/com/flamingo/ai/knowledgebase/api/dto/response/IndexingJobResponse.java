package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import com.flamingo.ai.knowledgebase.service.indexing.IndexingJob;
import com.flamingo.ai.knowledgebase.service.indexing.IndexingOutcome;
import com.flamingo.ai.knowledgebase.service.indexing.IndexingReport;
import com.flamingo.ai.knowledgebase.service.operation.ProgressInfo;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a background index rebuild. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingJobResponse {

  private String operationId;
  private Instant startedAt;
  private boolean finished;
  private IndexStatus indexStatus;

  /** Null until the first progress report. */
  private Progress progress;

  /** Null while running. */
  private IndexingOutcome outcome;

  private List<String> indexedDocumentIds;
  private List<IndexingReport.SkippedFile> skippedFiles;
  private Integer chunkCount;
  private Duration elapsed;
  private String message;

  public static IndexingJobResponse from(IndexingJob job, IndexStatus indexStatus) {
    IndexingJobResponseBuilder builder =
        IndexingJobResponse.builder()
            .operationId(job.getOperationId())
            .startedAt(job.getStartedAt())
            .finished(job.isFinished())
            .indexStatus(indexStatus);
    ProgressInfo progress = job.getProgress();
    if (progress != null) {
      builder.progress(
          new Progress(
              progress.current(),
              progress.total(),
              progress.percentage(),
              progress.message(),
              progress.estimatedRemaining().orElse(null)));
    }
    IndexingReport report = job.getReport();
    if (report != null) {
      builder
          .outcome(report.outcome())
          .indexedDocumentIds(report.indexedDocumentIds())
          .skippedFiles(report.skippedFiles())
          .chunkCount(report.chunkCount())
          .elapsed(report.elapsed())
          .message(report.message());
    }
    return builder.build();
  }

  /** Latest progress snapshot. */
  @Data
  @AllArgsConstructor
  public static class Progress {
    private int current;
    private int total;
    private double percentage;
    private String message;
    private Duration estimatedRemaining;
  }
}
