package com.flamingo.ai.knowledgebase.service.retrieval;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.InvalidParameterException;
import com.flamingo.ai.knowledgebase.exception.NoRelevantDocumentsException;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Selects the chunks most similar to a question. */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final VectorCollectionManager collectionManager;
  private final KnowledgeBaseProperties properties;

  public List<RetrievedChunk> retrieve(String question) {
    var retrieval = properties.getRetrieval();
    return retrieve(question, retrieval.getTopK(), retrieval.getMinSimilarity());
  }

  /**
   * Over-fetches {@code 2 * topK} candidates, drops those below {@code minSimilarity} and keeps
   * the best {@code topK}. An empty list means nothing cleared the threshold.
   */
  public List<RetrievedChunk> retrieve(String question, int topK, double minSimilarity) {
    if (topK < 1) {
      throw new InvalidParameterException("top_k", topK, ">= 1");
    }
    List<RetrievedChunk> results =
        collectionManager.search(question, topK * 2).stream()
            .map(m -> new RetrievedChunk(m.id(), m.content(), m.metadata(), m.distance()))
            .filter(chunk -> chunk.similarity() >= minSimilarity)
            .limit(topK)
            .toList();
    log.debug(
        "Retrieved {} chunk(s) for top_k={} min_similarity={}",
        results.size(),
        topK,
        minSimilarity);
    return results;
  }

  /**
   * Like {@link #retrieve(String, int, double)} but treats an empty result as an error.
   *
   * @throws NoRelevantDocumentsException if nothing cleared the threshold
   */
  public List<RetrievedChunk> retrieveRequired(String question, int topK, double minSimilarity) {
    List<RetrievedChunk> results = retrieve(question, topK, minSimilarity);
    if (results.isEmpty()) {
      throw new NoRelevantDocumentsException(question, minSimilarity);
    }
    return results;
  }
}
