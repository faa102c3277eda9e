package com.flamingo.ai.knowledgebase.service.embedding;

import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import java.util.List;

/** Turns texts into fixed-length vectors with the active embedding model. */
public interface EmbeddingProvider {

  /** Name of the model currently used by {@link #embed}. */
  String activeModel();

  /**
   * Embeds texts in order. Implementations may degrade to a local fallback instead of failing;
   * the returned batch records which happened.
   */
  EmbeddingBatch embed(List<String> texts, CancellationToken cancellationToken);

  /**
   * Vector length produced by the given model.
   *
   * @throws com.flamingo.ai.knowledgebase.exception.EmbeddingUnavailableException if the model
   *     is unknown and cannot be probed
   */
  int expectedDimension(String modelName);
}
