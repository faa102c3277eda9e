package com.flamingo.ai.knowledgebase.service.embedding;

import java.util.List;

/**
 * Vectors for a list of texts, in input order, all of the same length.
 *
 * @param modelName the model that produced the vectors, or the fallback's name
 */
public record EmbeddingBatch(List<float[]> vectors, EmbeddingSource source, String modelName) {

  public EmbeddingBatch {
    vectors = List.copyOf(vectors);
  }

  public int dimension() {
    return vectors.isEmpty() ? 0 : vectors.get(0).length;
  }

  public int size() {
    return vectors.size();
  }

  public float[] get(int index) {
    return vectors.get(index);
  }
}
