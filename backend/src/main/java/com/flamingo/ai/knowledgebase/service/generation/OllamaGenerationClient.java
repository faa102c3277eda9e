package com.flamingo.ai.knowledgebase.service.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.GenerationFailedException;
import com.flamingo.ai.knowledgebase.exception.GenerationTimeoutException;
import com.flamingo.ai.knowledgebase.exception.GenerationUnavailableException;
import com.flamingo.ai.knowledgebase.exception.KnowledgeBaseException;
import com.flamingo.ai.knowledgebase.exception.MalformedStreamException;
import com.google.common.annotations.VisibleForTesting;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * {@link GenerationClient} for Ollama's {@code /api/generate} and {@code /api/tags} endpoints.
 *
 * <p>Streaming responses are newline-delimited JSON. Lines that do not parse are skipped with a
 * warning; a stream that ends without one readable line fails with {@link
 * MalformedStreamException}.
 */
@Component
@Slf4j
public class OllamaGenerationClient implements GenerationClient {

  private final WebClient webClient;
  private final KnowledgeBaseProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public OllamaGenerationClient(KnowledgeBaseProperties properties, ObjectMapper objectMapper) {
    this(
        WebClient.builder()
            .baseUrl(properties.getOllama().getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient(properties.getOllama())))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build(),
        properties,
        objectMapper);
    log.info(
        "Ollama generation client initialized: baseUrl={}, model={}",
        properties.getOllama().getBaseUrl(),
        properties.getOllama().getGenerationModel());
  }

  @VisibleForTesting
  static HttpClient httpClient(KnowledgeBaseProperties.Ollama ollama) {
    return HttpClient.create()
        .option(
            ChannelOption.CONNECT_TIMEOUT_MILLIS,
            Math.toIntExact(ollama.getConnectTimeout().toMillis()));
  }

  @VisibleForTesting
  OllamaGenerationClient(
      WebClient webClient, KnowledgeBaseProperties properties, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public String modelName() {
    return properties.getOllama().getGenerationModel();
  }

  @Override
  public String generate(String prompt, GenerationOptions options) {
    options.validate();
    String model = modelName();
    Duration timeout = properties.getOllama().getGenerateTimeout();
    JsonNode response =
        webClient
            .post()
            .uri("/api/generate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(GenerateRequest.of(model, prompt, false, options))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .onErrorMap(e -> mapError(e, model, timeout))
            .block();
    if (response == null || !response.hasNonNull("response")) {
      throw new GenerationFailedException(
          model, 200, response == null ? "empty body" : response.toString());
    }
    return response.get("response").asText();
  }

  @Override
  public Flux<String> generateStream(String prompt, GenerationOptions options) {
    options.validate();
    String model = modelName();
    Duration timeout = properties.getOllama().getStreamTimeout();
    return Flux.defer(
        () -> {
          AtomicBoolean readable = new AtomicBoolean(false);
          AtomicInteger skipped = new AtomicInteger();
          return webClient
              .post()
              .uri("/api/generate")
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_NDJSON)
              .bodyValue(GenerateRequest.of(model, prompt, true, options))
              .retrieve()
              .bodyToFlux(String.class)
              .timeout(timeout)
              .filter(line -> !line.isBlank())
              .concatMap(line -> Mono.justOrEmpty(parseLine(line, skipped)))
              .doOnNext(line -> readable.set(true))
              .takeUntil(StreamLine::done)
              .map(StreamLine::response)
              .filter(fragment -> !fragment.isEmpty())
              .concatWith(
                  Mono.defer(
                      () ->
                          readable.get()
                              ? Mono.empty()
                              : Mono.error(new MalformedStreamException(model, skipped.get()))))
              .onErrorMap(e -> mapError(e, model, timeout));
        });
  }

  @Override
  public List<String> listModels() {
    Duration timeout = properties.getOllama().getTagsTimeout();
    TagsResponse response =
        webClient
            .get()
            .uri("/api/tags")
            .retrieve()
            .bodyToMono(TagsResponse.class)
            .timeout(timeout)
            .onErrorMap(e -> mapError(e, "tags", timeout))
            .block();
    if (response == null || response.models() == null) {
      return List.of();
    }
    return response.models().stream().map(ModelTag::name).toList();
  }

  @Override
  public List<String> listModelsOrFallback(List<String> fallback) {
    try {
      return listModels();
    } catch (KnowledgeBaseException e) {
      log.warn(
          "Cannot list models, using {} fallback model(s): {}", fallback.size(), e.getMessage());
      return List.copyOf(fallback);
    }
  }

  @Override
  public boolean isAvailable() {
    try {
      listModels();
      return true;
    } catch (KnowledgeBaseException e) {
      log.debug("Ollama not available: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public boolean isModelAvailable(String modelName) {
    try {
      return matchesInstalled(modelName, listModels());
    } catch (KnowledgeBaseException e) {
      log.debug("Cannot check model '{}': {}", modelName, e.getMessage());
      return false;
    }
  }

  static boolean matchesInstalled(String modelName, List<String> installed) {
    String wanted = modelName.contains(":") ? modelName : modelName + ":latest";
    return installed.stream().anyMatch(name -> name.equals(modelName) || name.equals(wanted));
  }

  private Optional<StreamLine> parseLine(String line, AtomicInteger skipped) {
    try {
      JsonNode node = objectMapper.readTree(line);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException("not a JSON object");
      }
      String fragment = node.path("response").asText("");
      return Optional.of(new StreamLine(fragment, node.path("done").asBoolean(false)));
    } catch (Exception e) {
      skipped.incrementAndGet();
      log.warn("Skipping malformed stream line: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Throwable mapError(Throwable error, String model, Duration timeout) {
    if (error instanceof KnowledgeBaseException) {
      return error;
    }
    if (error instanceof TimeoutException) {
      return new GenerationTimeoutException(model, timeout, error);
    }
    if (error instanceof WebClientResponseException response) {
      return new GenerationFailedException(
          model, response.getStatusCode().value(), response.getResponseBodyAsString());
    }
    if (error instanceof WebClientRequestException) {
      return new GenerationUnavailableException(properties.getOllama().getBaseUrl(), error);
    }
    log.error("Unexpected generation error for '{}': {}", model, error.getMessage(), error);
    return new GenerationUnavailableException(properties.getOllama().getBaseUrl(), error);
  }

  record StreamLine(String response, boolean done) {}

  record GenerateRequest(String model, String prompt, boolean stream, RequestOptions options) {

    static GenerateRequest of(
        String model, String prompt, boolean stream, GenerationOptions options) {
      return new GenerateRequest(
          model,
          prompt,
          stream,
          new RequestOptions(
              options.temperature(),
              options.topP(),
              options.topK(),
              options.maxTokens(),
              options.maxTokens(),
              options.stop()));
    }
  }

  /** Ollama reads {@code num_predict}; {@code max_tokens} is sent alongside for compatibility. */
  record RequestOptions(
      double temperature,
      double top_p,
      int top_k,
      int max_tokens,
      int num_predict,
      List<String> stop) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TagsResponse(List<ModelTag> models) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ModelTag(String name) {}
}
