package com.flamingo.ai.knowledgebase.service.embedding;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.EmbeddingUnavailableException;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.google.common.collect.Lists;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingProvider} backed by an Ollama embedding model through LangChain4j.
 *
 * <p>Requests above {@value #BATCHING_THRESHOLD} texts are sent in sub-batches of {@value
 * #BATCH_SIZE}, one at a time, with a cancellation check after each. If the endpoint fails or the
 * circuit is open, the whole request is answered by {@link HashEmbeddingFallback} so that
 * indexing continues in degraded mode; cancellation is never converted into a fallback.
 */
@Service
@Slf4j
public class OllamaEmbeddingProvider implements EmbeddingProvider {

  static final int BATCHING_THRESHOLD = 100;
  static final int BATCH_SIZE = 50;
  private static final String PROBE_TEXT = "dimension probe";

  private final EmbeddingModelFactory modelFactory;
  private final KnowledgeBaseProperties properties;
  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;
  private final Map<String, EmbeddingModel> models = new ConcurrentHashMap<>();
  private final Map<String, Integer> probedDimensions = new ConcurrentHashMap<>();

  public OllamaEmbeddingProvider(
      EmbeddingModelFactory modelFactory,
      KnowledgeBaseProperties properties,
      @Qualifier("embeddingCircuitBreaker") CircuitBreaker circuitBreaker,
      MeterRegistry meterRegistry) {
    this.modelFactory = modelFactory;
    this.properties = properties;
    this.circuitBreaker = circuitBreaker;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String activeModel() {
    return properties.getOllama().getEmbeddingModel();
  }

  @Override
  public EmbeddingBatch embed(List<String> texts, CancellationToken cancellationToken) {
    if (texts.isEmpty()) {
      return new EmbeddingBatch(List.of(), EmbeddingSource.REMOTE, activeModel());
    }
    cancellationToken.throwIfCancelled();
    String modelName = activeModel();

    List<List<String>> batches = partition(texts);
    if (batches.size() > 1) {
      log.info("Embedding {} texts in {} batches of {}", texts.size(), batches.size(), BATCH_SIZE);
    }
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int i = 0; i < batches.size(); i++) {
      if (i > 0) {
        cancellationToken.throwIfCancelled();
      }
      List<String> batch = batches.get(i);
      List<float[]> batchVectors;
      try {
        batchVectors = circuitBreaker.executeSupplier(() -> callModel(modelName, batch));
      } catch (CallNotPermittedException e) {
        return fallback(texts, modelName, "circuit open");
      } catch (RuntimeException e) {
        return fallback(texts, modelName, e.getMessage());
      }
      vectors.addAll(batchVectors);
    }
    meterRegistry.counter("embedding.requests", "outcome", "success").increment();
    return new EmbeddingBatch(vectors, EmbeddingSource.REMOTE, modelName);
  }

  @Override
  public int expectedDimension(String modelName) {
    return EmbeddingModelCatalog.knownDimension(modelName)
        .orElseGet(() -> probedDimensions.computeIfAbsent(modelName, this::probeDimension));
  }

  private int probeDimension(String modelName) {
    try {
      int dimension = callModel(modelName, List.of(PROBE_TEXT)).get(0).length;
      log.info("Probed embedding model '{}': dimension {}", modelName, dimension);
      return dimension;
    } catch (RuntimeException e) {
      log.warn("Dimension probe for '{}' failed: {}", modelName, e.getMessage());
      throw new EmbeddingUnavailableException(modelName, e);
    }
  }

  private List<float[]> callModel(String modelName, List<String> texts) {
    EmbeddingModel model = models.computeIfAbsent(modelName, modelFactory::create);
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    List<Embedding> embeddings = model.embedAll(segments).content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new IllegalStateException(
          "Model '"
              + modelName
              + "' returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + texts.size()
              + " texts");
    }
    return embeddings.stream().map(Embedding::vector).toList();
  }

  private EmbeddingBatch fallback(List<String> texts, String modelName, String cause) {
    log.warn(
        "Embedding model '{}' unavailable, using hash fallback for {} text(s): {}",
        modelName,
        texts.size(),
        cause);
    meterRegistry.counter("embedding.requests", "outcome", "fallback").increment();
    return HashEmbeddingFallback.embed(texts);
  }

  private static List<List<String>> partition(List<String> texts) {
    if (texts.size() <= BATCHING_THRESHOLD) {
      return List.of(texts);
    }
    return Lists.partition(texts, BATCH_SIZE);
  }
}
