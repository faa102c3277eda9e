package com.flamingo.ai.knowledgebase.config;

import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingModelFactory;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the Ollama embedding models and the circuit breaker guarding them. */
@Configuration
@Slf4j
public class OllamaConfig {

  /**
   * Builds embedding models on demand so that switching the active model needs no restart.
   *
   * @param properties endpoint URL and timeout
   * @return a factory creating one LangChain4j model per name
   */
  @Bean
  public EmbeddingModelFactory embeddingModelFactory(KnowledgeBaseProperties properties) {
    return modelName -> {
      KnowledgeBaseProperties.Ollama ollama = properties.getOllama();
      log.info("Creating Ollama embedding model {} at {}", modelName, ollama.getBaseUrl());
      return OllamaEmbeddingModel.builder()
          .baseUrl(ollama.getBaseUrl())
          .modelName(modelName)
          .timeout(ollama.getEmbeddingTimeout())
          .build();
    };
  }

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry() {
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .build();
    return CircuitBreakerRegistry.of(config);
  }

  @Bean(name = "embeddingCircuitBreaker")
  public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
    CircuitBreaker circuitBreaker = registry.circuitBreaker("ollama-embedding");
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event -> log.warn("Embedding circuit breaker: {}", event.getStateTransition()));
    return circuitBreaker;
  }
}
