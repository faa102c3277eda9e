package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.generation.GenerationClient;
import com.flamingo.ai.knowledgebase.service.health.HealthStatus;
import com.flamingo.ai.knowledgebase.service.health.SystemHealth;
import com.flamingo.ai.knowledgebase.service.health.SystemHealthService;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and the model catalogue. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

  private final SystemHealthService systemHealthService;
  private final GenerationClient generationClient;
  private final KnowledgeBaseProperties properties;

  /** Per-dependency health; 503 when nothing is usable. */
  @GetMapping("/health")
  public ResponseEntity<SystemHealth> health() {
    SystemHealth health = systemHealthService.check();
    HttpStatus status =
        health.status() == HealthStatus.ERROR ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    return ResponseEntity.status(status).body(health);
  }

  /** Installed models, or the configured ones when the endpoint is unreachable. */
  @GetMapping("/models")
  public ResponseEntity<Map<String, Object>> models() {
    KnowledgeBaseProperties.Ollama ollama = properties.getOllama();
    List<String> fallback =
        ImmutableSet.<String>builder()
            .add(ollama.getGenerationModel(), ollama.getEmbeddingModel())
            .addAll(ollama.getFallbackEmbeddingModels())
            .build()
            .asList();
    List<String> models = generationClient.listModelsOrFallback(fallback);
    return ResponseEntity.ok(
        Map.of(
            "models", models,
            "generationModel", ollama.getGenerationModel(),
            "embeddingModel", ollama.getEmbeddingModel()));
  }
}
