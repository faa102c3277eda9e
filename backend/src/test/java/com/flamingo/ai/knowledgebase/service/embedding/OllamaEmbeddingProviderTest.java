package com.flamingo.ai.knowledgebase.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.EmbeddingUnavailableException;
import com.flamingo.ai.knowledgebase.exception.OperationCancelledException;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OllamaEmbeddingProvider Tests")
class OllamaEmbeddingProviderTest {

  @Mock private EmbeddingModel embeddingModel;

  private KnowledgeBaseProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private OllamaEmbeddingProvider provider;

  @BeforeEach
  void setUp() {
    properties = new KnowledgeBaseProperties();
    meterRegistry = new SimpleMeterRegistry();
    provider =
        new OllamaEmbeddingProvider(
            name -> embeddingModel,
            properties,
            CircuitBreaker.ofDefaults("test-embedding"),
            meterRegistry);
  }

  @Test
  @DisplayName("should return remote vectors in input order")
  void shouldEmbedRemotely() {
    when(embeddingModel.embedAll(anyList())).thenAnswer(inv -> vectorsFor(inv.getArgument(0), 3));

    EmbeddingBatch batch = provider.embed(List.of("a", "bb"), CancellationToken.detached());

    assertThat(batch.source()).isEqualTo(EmbeddingSource.REMOTE);
    assertThat(batch.modelName()).isEqualTo("nomic-embed-text");
    assertThat(batch.size()).isEqualTo(2);
    assertThat(batch.get(1)[0]).isEqualTo(2.0f);
    assertThat(meterRegistry.counter("embedding.requests", "outcome", "success").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should send more than 100 texts in batches of 50")
  void shouldBatchLargeRequests() {
    List<Integer> batchSizes = new ArrayList<>();
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            inv -> {
              List<TextSegment> segments = inv.getArgument(0);
              batchSizes.add(segments.size());
              return vectorsFor(segments, 3);
            });
    List<String> texts = IntStream.range(0, 120).mapToObj(i -> "text " + i).toList();

    EmbeddingBatch batch = provider.embed(texts, CancellationToken.detached());

    assertThat(batch.size()).isEqualTo(120);
    assertThat(batchSizes).containsExactly(50, 50, 20);
    verify(embeddingModel, times(3)).embedAll(anyList());
  }

  @Test
  @DisplayName("should fall back to hash vectors for the whole request when the model fails")
  void shouldFallBackOnFailure() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("connection refused"));

    EmbeddingBatch batch = provider.embed(List.of("a", "b"), CancellationToken.detached());

    assertThat(batch.source()).isEqualTo(EmbeddingSource.FALLBACK);
    assertThat(batch.dimension()).isEqualTo(HashEmbeddingFallback.DIMENSION);
    assertThat(batch.size()).isEqualTo(2);
    assertThat(meterRegistry.counter("embedding.requests", "outcome", "fallback").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should stop between batches once cancelled")
  void shouldStopWhenCancelled() {
    CancellationToken token = CancellationToken.detached();
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            inv -> {
              token.cancel("user");
              return vectorsFor(inv.getArgument(0), 3);
            });
    List<String> texts = IntStream.range(0, 150).mapToObj(i -> "text " + i).toList();

    assertThatThrownBy(() -> provider.embed(texts, token))
        .isInstanceOf(OperationCancelledException.class);
    verify(embeddingModel, times(1)).embedAll(anyList());
  }

  @Test
  @DisplayName("should not call the model for an already cancelled token")
  void shouldNotStartWhenCancelled() {
    CancellationToken token = CancellationToken.detached();
    token.cancel("user");

    assertThatThrownBy(() -> provider.embed(List.of("a"), token))
        .isInstanceOf(OperationCancelledException.class);
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("should answer known dimensions without calling the model")
  void shouldUseCatalogForKnownModels() {
    assertThat(provider.expectedDimension("mxbai-embed-large")).isEqualTo(1024);
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("should probe unknown models once")
  void shouldProbeUnknownModels() {
    when(embeddingModel.embedAll(anyList())).thenAnswer(inv -> vectorsFor(inv.getArgument(0), 5));

    assertThat(provider.expectedDimension("custom-embedder")).isEqualTo(5);
    assertThat(provider.expectedDimension("custom-embedder")).isEqualTo(5);
    verify(embeddingModel, times(1)).embedAll(anyList());
  }

  @Test
  @DisplayName("should report an unreachable unknown model")
  void shouldFailProbeWhenUnavailable() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("down"));

    assertThatThrownBy(() -> provider.expectedDimension("custom-embedder"))
        .isInstanceOf(EmbeddingUnavailableException.class);
  }

  /** Vector i is filled with the value i + 1. */
  private static Response<List<Embedding>> vectorsFor(List<TextSegment> segments, int dimension) {
    List<Embedding> embeddings =
        IntStream.range(0, segments.size())
            .mapToObj(
                i -> {
                  float[] vector = new float[dimension];
                  java.util.Arrays.fill(vector, i + 1);
                  return Embedding.from(vector);
                })
            .toList();
    return Response.from(embeddings);
  }
}
