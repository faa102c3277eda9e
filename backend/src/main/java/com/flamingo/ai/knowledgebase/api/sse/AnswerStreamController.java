package com.flamingo.ai.knowledgebase.api.sse;

import com.flamingo.ai.knowledgebase.api.dto.request.QuestionRequest;
import com.flamingo.ai.knowledgebase.api.dto.response.StreamEventResponse;
import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.ApiError;
import com.flamingo.ai.knowledgebase.exception.KnowledgeBaseException;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.rag.RagOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for question answering with SSE streaming. */
@RestController
@RequestMapping("/api/questions")
@Slf4j
public class AnswerStreamController {

  private final RagOrchestrator ragOrchestrator;
  private final CancellationRegistry cancellationRegistry;
  private final KnowledgeBaseProperties properties;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections;

  public AnswerStreamController(
      RagOrchestrator ragOrchestrator,
      CancellationRegistry cancellationRegistry,
      KnowledgeBaseProperties properties,
      MeterRegistry meterRegistry) {
    this.ragOrchestrator = ragOrchestrator;
    this.cancellationRegistry = cancellationRegistry;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.activeConnections =
        meterRegistry.gauge("sse.connections.active", new AtomicInteger(0));
  }

  /**
   * Streams an answer using Server-Sent Events.
   *
   * <p>The first event carries the operation id for cancellation, then token events, one sources
   * event and a done event. Failures end the stream with an error event.
   *
   * @param request the question and optional history and sampling overrides
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamEventResponse> streamAnswer(@Valid @RequestBody QuestionRequest request) {
    CancellationToken token = cancellationRegistry.create(request.getOperationId());
    log.info("Starting answer stream {}", token.getId());
    activeConnections.incrementAndGet();

    Flux<StreamEventResponse> answer =
        ragOrchestrator
            .answerStream(
                request.getQuestion(),
                request.toHistory(),
                request.toOptions(properties.getGeneration()),
                token)
            .map(StreamEventResponse::from);

    return Flux.just(StreamEventResponse.operation(token.getId()))
        .concatWith(answer)
        .onErrorResume(
            e -> {
              log.error("Answer stream {} failed: {}", token.getId(), e.getMessage());
              meterRegistry.counter("sse.errors").increment();
              return Flux.just(toErrorEvent(e));
            })
        .doOnCancel(
            () -> {
              token.cancel("Client disconnected");
              log.debug("Answer stream {} cancelled by client", token.getId());
            })
        .doFinally(
            signal -> {
              activeConnections.decrementAndGet();
              cancellationRegistry.release(token.getId());
            });
  }

  private static StreamEventResponse toErrorEvent(Throwable error) {
    if (error instanceof KnowledgeBaseException kbe) {
      return StreamEventResponse.error(kbe.getErrorCode().getCode(), kbe.getUserMessage());
    }
    return StreamEventResponse.error(ApiError.INTERNAL_ERROR, "An unexpected error occurred");
  }
}
