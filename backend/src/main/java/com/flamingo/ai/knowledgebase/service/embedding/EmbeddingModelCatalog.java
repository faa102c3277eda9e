package com.flamingo.ai.knowledgebase.service.embedding;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Known embedding models and the vector length they produce. */
public final class EmbeddingModelCatalog {

  private static final Map<String, Integer> DIMENSIONS =
      Map.of(
          "nomic-embed-text", 768,
          "mxbai-embed-large", 1024,
          "all-minilm", 384,
          "snowflake-arctic-embed", 1024,
          "bge-m3", 1024,
          "bge-large", 1024);

  private EmbeddingModelCatalog() {}

  /** Looks up a model, ignoring a {@code :latest} style tag. */
  public static Optional<Integer> knownDimension(String modelName) {
    if (modelName == null) {
      return Optional.empty();
    }
    String base = modelName.toLowerCase(Locale.ROOT);
    int tag = base.indexOf(':');
    if (tag > 0) {
      base = base.substring(0, tag);
    }
    return Optional.ofNullable(DIMENSIONS.get(base));
  }

  public static boolean isKnown(String modelName) {
    return knownDimension(modelName).isPresent();
  }
}
