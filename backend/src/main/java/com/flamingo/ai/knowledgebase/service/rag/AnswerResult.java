package com.flamingo.ai.knowledgebase.service.rag;

import java.time.Duration;
import java.util.List;

/**
 * A generated answer with its attributions.
 *
 * @param grounded whether retrieved context was supplied to the model
 * @param confidence heuristic score in [0, 1]; 0 for ungrounded answers
 */
public record AnswerResult(
    String query,
    String answer,
    List<SourceAttribution> sources,
    Duration processingTime,
    double confidence,
    boolean grounded) {

  public AnswerResult {
    sources = List.copyOf(sources);
  }
}
