package com.flamingo.ai.knowledgebase.service.rag;

import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import java.util.List;

/** Heuristic confidence of a grounded answer. */
final class ConfidenceCalculator {

  static final double SIMILARITY_WEIGHT = 0.6;
  static final double SOURCE_COUNT_WEIGHT = 0.25;
  static final double ANSWER_LENGTH_WEIGHT = 0.15;
  static final int SATURATING_SOURCE_COUNT = 3;
  static final int SATURATING_ANSWER_LENGTH = 200;

  private ConfidenceCalculator() {}

  /**
   * Weighted sum of the average source similarity, the source count saturating at three and the
   * answer length saturating at 200 characters; clamped to [0, 1] and rounded to three decimals.
   * Zero without sources.
   */
  static double score(List<RetrievedChunk> sources, String answer) {
    if (sources.isEmpty()) {
      return 0.0;
    }
    double averageSimilarity =
        sources.stream().mapToDouble(RetrievedChunk::similarity).average().orElse(0.0);
    double sourceFactor = Math.min((double) sources.size() / SATURATING_SOURCE_COUNT, 1.0);
    int length = answer == null ? 0 : answer.length();
    double lengthFactor = Math.min((double) length / SATURATING_ANSWER_LENGTH, 1.0);
    double score =
        averageSimilarity * SIMILARITY_WEIGHT
            + sourceFactor * SOURCE_COUNT_WEIGHT
            + lengthFactor * ANSWER_LENGTH_WEIGHT;
    double clamped = Math.max(0.0, Math.min(score, 1.0));
    return Math.round(clamped * 1000.0) / 1000.0;
  }
}
