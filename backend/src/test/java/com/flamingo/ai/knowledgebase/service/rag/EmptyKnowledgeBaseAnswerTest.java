package com.flamingo.ai.knowledgebase.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.generation.GenerationClient;
import com.flamingo.ai.knowledgebase.service.generation.GenerationOptions;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.retrieval.Retriever;
import com.flamingo.ai.knowledgebase.support.FakeEmbeddingProvider;
import com.flamingo.ai.knowledgebase.support.MutableClock;
import com.flamingo.ai.knowledgebase.support.TestComponents;
import com.flamingo.ai.knowledgebase.vectorstore.LocalFileVectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Answering against an empty knowledge base")
class EmptyKnowledgeBaseAnswerTest {

  @TempDir Path tempDir;

  @Mock private GenerationClient generationClient;

  @Test
  void shouldReturnAnswerWithoutSources_whenCollectionIsEmpty() {
    // Given
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    MutableClock clock = MutableClock.startingAtEpoch();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    VectorCollectionManager manager =
        TestComponents.collectionManager(
            new LocalFileVectorStore(tempDir),
            FakeEmbeddingProvider.withDefaultModels(properties),
            properties,
            clock,
            meterRegistry);
    RagOrchestrator orchestrator =
        new RagOrchestrator(
            new Retriever(manager, properties), generationClient, properties, clock, meterRegistry);
    when(generationClient.generate(anyString(), any(GenerationOptions.class)))
        .thenReturn("Hello! How can I help you today?");

    // When
    AnswerResult result = orchestrator.answer("hello", List.of(), CancellationToken.detached());

    // Then
    assertThat(manager.count()).isZero();
    assertThat(result.sources()).isEmpty();
    assertThat(result.answer()).isNotBlank();
    assertThat(result.grounded()).isFalse();
  }
}
