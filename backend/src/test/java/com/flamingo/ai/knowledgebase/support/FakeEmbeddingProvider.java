package com.flamingo.ai.knowledgebase.support;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.EmbeddingUnavailableException;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingBatch;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingProvider;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingSource;
import com.flamingo.ai.knowledgebase.service.embedding.HashEmbeddingFallback;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Term-frequency embeddings: each lower-cased word is hashed into a bucket of a vector whose
 * length depends on the active model. Texts sharing words are close; unrelated texts are not.
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {

  private final KnowledgeBaseProperties properties;
  private final Map<String, Integer> dimensions;
  private boolean unavailable;
  private int calls;

  public FakeEmbeddingProvider(
      KnowledgeBaseProperties properties, Map<String, Integer> dimensions) {
    this.properties = properties;
    this.dimensions = dimensions;
  }

  /** nomic-embed-text at 768 and mxbai-embed-large at 1024. */
  public static FakeEmbeddingProvider withDefaultModels(KnowledgeBaseProperties properties) {
    return new FakeEmbeddingProvider(
        properties, Map.of("nomic-embed-text", 768, "mxbai-embed-large", 1024));
  }

  /** While unavailable, embeddings come from the hash fallback and probes fail. */
  public void setUnavailable(boolean unavailable) {
    this.unavailable = unavailable;
  }

  public int calls() {
    return calls;
  }

  @Override
  public String activeModel() {
    return properties.getOllama().getEmbeddingModel();
  }

  @Override
  public EmbeddingBatch embed(List<String> texts, CancellationToken cancellationToken) {
    cancellationToken.throwIfCancelled();
    calls++;
    if (unavailable) {
      return HashEmbeddingFallback.embed(texts);
    }
    int dimension = expectedDimension(activeModel());
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(vectorOf(text, dimension));
    }
    return new EmbeddingBatch(vectors, EmbeddingSource.REMOTE, activeModel());
  }

  @Override
  public int expectedDimension(String modelName) {
    Integer dimension = dimensions.get(modelName);
    if (unavailable || dimension == null) {
      throw new EmbeddingUnavailableException(
          modelName, new IllegalStateException("model not available"));
    }
    return dimension;
  }

  private static float[] vectorOf(String text, int dimension) {
    float[] vector = new float[dimension];
    for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (!word.isEmpty()) {
        vector[Math.floorMod(word.hashCode(), dimension)] += 1f;
      }
    }
    return vector;
  }
}
