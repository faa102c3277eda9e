package com.flamingo.ai.knowledgebase.service.generation;

import java.util.List;
import reactor.core.publisher.Flux;

/** Client for the local text generation endpoint. */
public interface GenerationClient {

  String modelName();

  /** Blocking call returning the complete answer. */
  String generate(String prompt, GenerationOptions options);

  /** Answer fragments in arrival order; completes when the endpoint reports it is done. */
  Flux<String> generateStream(String prompt, GenerationOptions options);

  /** Names of installed models. */
  List<String> listModels();

  /** Installed models, or the given list when the endpoint cannot be reached. */
  List<String> listModelsOrFallback(List<String> fallback);

  boolean isAvailable();

  boolean isModelAvailable(String modelName);
}
