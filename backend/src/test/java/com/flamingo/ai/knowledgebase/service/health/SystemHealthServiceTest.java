package com.flamingo.ai.knowledgebase.service.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import com.flamingo.ai.knowledgebase.exception.VectorStoreException;
import com.flamingo.ai.knowledgebase.service.collection.CollectionStats;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.generation.GenerationClient;
import com.flamingo.ai.knowledgebase.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SystemHealthServiceTest {

  @Mock private VectorCollectionManager collectionManager;

  @Mock private GenerationClient generationClient;

  private KnowledgeBaseProperties properties;
  private SystemHealthService healthService;

  @BeforeEach
  void setUp() {
    properties = new KnowledgeBaseProperties();
    healthService =
        new SystemHealthService(
            collectionManager, generationClient, properties, MutableClock.startingAtEpoch());
    when(generationClient.modelName()).thenReturn("llama3:8b");
  }

  @Test
  void shouldBeHealthy_whenCollectionAndModelUsable() {
    // Given
    properties.setIndexStatus(IndexStatus.CREATED);
    when(collectionManager.stats()).thenReturn(stats(3, 12));
    when(generationClient.isAvailable()).thenReturn(true);
    when(generationClient.isModelAvailable("llama3:8b")).thenReturn(true);

    // When
    SystemHealth health = healthService.check();

    // Then
    assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(health.collection().documentCount()).isEqualTo(3);
    assertThat(health.collection().chunkCount()).isEqualTo(12);
    assertThat(health.generation().model()).isEqualTo("llama3:8b");
    assertThat(health.indexStatus()).isEqualTo(IndexStatus.CREATED);
    assertThat(health.checkedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
  }

  @Test
  void shouldBeDegraded_whenModelNotInstalled() {
    // Given
    when(collectionManager.stats()).thenReturn(stats(0, 0));
    when(generationClient.isAvailable()).thenReturn(true);
    when(generationClient.isModelAvailable("llama3:8b")).thenReturn(false);

    // When
    SystemHealth health = healthService.check();

    // Then
    assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
    assertThat(health.generation().connected()).isTrue();
    assertThat(health.generation().modelAvailable()).isFalse();
  }

  @Test
  void shouldBeDegraded_whenCollectionUnreachable() {
    // Given
    when(collectionManager.stats())
        .thenThrow(new VectorStoreException("knowledge_base", "connection refused", null));
    when(generationClient.isAvailable()).thenReturn(true);
    when(generationClient.isModelAvailable("llama3:8b")).thenReturn(true);

    // When
    SystemHealth health = healthService.check();

    // Then
    assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
    assertThat(health.collection().reachable()).isFalse();
    assertThat(health.collection().name()).isEqualTo("knowledge_base");
    assertThat(health.collection().error()).contains("connection refused");
  }

  @Test
  void shouldBeError_whenNothingUsable() {
    // Given
    when(collectionManager.stats()).thenThrow(new IllegalStateException("store closed"));
    when(generationClient.isAvailable()).thenReturn(false);

    // When
    SystemHealth health = healthService.check();

    // Then
    assertThat(health.status()).isEqualTo(HealthStatus.ERROR);
    verify(generationClient, never()).isModelAvailable("llama3:8b");
  }

  private static CollectionStats stats(long documents, long chunks) {
    return new CollectionStats(
        "knowledge_base",
        documents > 0,
        chunks,
        documents,
        0,
        "nomic-embed-text",
        768,
        "./data/vector_store",
        true);
  }
}
