package com.flamingo.ai.knowledgebase.service.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;

/** Creates a LangChain4j embedding model for a model name. */
@FunctionalInterface
public interface EmbeddingModelFactory {

  EmbeddingModel create(String modelName);
}
