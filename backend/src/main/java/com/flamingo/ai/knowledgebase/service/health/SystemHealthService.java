package com.flamingo.ai.knowledgebase.service.health;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.collection.CollectionStats;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.generation.GenerationClient;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Probes the collection and the generation endpoint.
 *
 * <p>The system is {@link HealthStatus#HEALTHY} when both are usable, {@link
 * HealthStatus#DEGRADED} when only one is, and {@link HealthStatus#ERROR} when neither is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemHealthService {

  private final VectorCollectionManager collectionManager;
  private final GenerationClient generationClient;
  private final KnowledgeBaseProperties properties;
  private final Clock clock;

  public SystemHealth check() {
    SystemHealth.CollectionHealth collection = checkCollection();
    SystemHealth.GenerationHealth generation = checkGeneration();

    boolean generationUsable = generation.connected() && generation.modelAvailable();
    HealthStatus status;
    if (collection.reachable() && generationUsable) {
      status = HealthStatus.HEALTHY;
    } else if (collection.reachable() || generationUsable) {
      status = HealthStatus.DEGRADED;
    } else {
      status = HealthStatus.ERROR;
    }
    return new SystemHealth(
        status, collection, generation, properties.getIndexStatus(), clock.instant());
  }

  private SystemHealth.CollectionHealth checkCollection() {
    String name = properties.getCollection().getName();
    try {
      CollectionStats stats = collectionManager.stats();
      return new SystemHealth.CollectionHealth(
          true, stats.name(), stats.documentCount(), stats.chunkCount(), null);
    } catch (RuntimeException e) {
      log.warn("Collection '{}' is not reachable: {}", name, e.getMessage());
      return new SystemHealth.CollectionHealth(false, name, 0, 0, e.getMessage());
    }
  }

  private SystemHealth.GenerationHealth checkGeneration() {
    String model = generationClient.modelName();
    boolean connected = generationClient.isAvailable();
    boolean modelAvailable = connected && generationClient.isModelAvailable(model);
    if (connected && !modelAvailable) {
      log.warn("Generation model {} is not installed", model);
    }
    return new SystemHealth.GenerationHealth(connected, model, modelAvailable);
  }
}
