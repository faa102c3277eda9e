package com.flamingo.ai.knowledgebase.service.health;

import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import java.time.Instant;

/** Result of a health probe, one section per dependency. */
public record SystemHealth(
    HealthStatus status,
    CollectionHealth collection,
    GenerationHealth generation,
    IndexStatus indexStatus,
    Instant checkedAt) {

  /**
   * State of the vector collection.
   *
   * @param error failure message when the store could not be reached
   */
  public record CollectionHealth(
      boolean reachable, String name, long documentCount, long chunkCount, String error) {}

  /** State of the generation endpoint and its configured model. */
  public record GenerationHealth(boolean connected, String model, boolean modelAvailable) {}
}
