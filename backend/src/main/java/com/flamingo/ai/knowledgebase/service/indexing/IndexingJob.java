package com.flamingo.ai.knowledgebase.service.indexing;

import com.flamingo.ai.knowledgebase.service.operation.ProgressInfo;
import java.time.Instant;
import lombok.Getter;

/** A background indexing run, observable by its operation id. */
@Getter
public class IndexingJob {

  private final String operationId;
  private final Instant startedAt;
  private volatile ProgressInfo progress;
  private volatile IndexingReport report;
  private volatile Instant finishedAt;

  IndexingJob(String operationId, Instant startedAt) {
    this.operationId = operationId;
    this.startedAt = startedAt;
  }

  public boolean isFinished() {
    return report != null;
  }

  void setProgress(ProgressInfo progress) {
    this.progress = progress;
  }

  void finish(IndexingReport report, Instant finishedAt) {
    this.finishedAt = finishedAt;
    this.report = report;
  }
}
