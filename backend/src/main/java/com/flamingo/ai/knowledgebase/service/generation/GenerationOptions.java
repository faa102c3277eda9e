package com.flamingo.ai.knowledgebase.service.generation;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.InvalidParameterException;
import java.util.List;

/** Sampling parameters sent with every generation request. */
public record GenerationOptions(
    double temperature, double topP, int topK, int maxTokens, List<String> stop) {

  public GenerationOptions {
    stop = stop == null ? List.of() : List.copyOf(stop);
  }

  public static GenerationOptions from(KnowledgeBaseProperties.Generation generation) {
    return new GenerationOptions(
        generation.getTemperature(),
        generation.getTopP(),
        generation.getTopK(),
        generation.getMaxTokens(),
        generation.getStop());
  }

  /**
   * Checks every parameter against its allowed range.
   *
   * @throws InvalidParameterException naming the first offending parameter
   */
  public GenerationOptions validate() {
    if (temperature < 0.0 || temperature > 2.0) {
      throw new InvalidParameterException("temperature", temperature, "0.0-2.0");
    }
    if (topP < 0.0 || topP > 1.0) {
      throw new InvalidParameterException("top_p", topP, "0.0-1.0");
    }
    if (topK < 1 || topK > 100) {
      throw new InvalidParameterException("top_k", topK, "1-100");
    }
    if (maxTokens < 1 || maxTokens > 10000) {
      throw new InvalidParameterException("max_tokens", maxTokens, "1-10000");
    }
    return this;
  }
}
