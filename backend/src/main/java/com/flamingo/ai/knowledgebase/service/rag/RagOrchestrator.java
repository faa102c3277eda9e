package com.flamingo.ai.knowledgebase.service.rag;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.InvalidParameterException;
import com.flamingo.ai.knowledgebase.exception.OperationCancelledException;
import com.flamingo.ai.knowledgebase.service.generation.GenerationClient;
import com.flamingo.ai.knowledgebase.service.generation.GenerationOptions;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import com.flamingo.ai.knowledgebase.service.retrieval.Retriever;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Answers questions from the knowledge base.
 *
 * <p>Retrieved chunks are packed into a bounded context and sent with a grounding prompt. When
 * nothing relevant is retrieved the question is answered from the model's general knowledge
 * instead, so an empty knowledge base still produces an answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RagOrchestrator {

  private final Retriever retriever;
  private final GenerationClient generationClient;
  private final KnowledgeBaseProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public AnswerResult answer(
      String question, List<ConversationTurn> history, CancellationToken token) {
    return answer(question, history, GenerationOptions.from(properties.getGeneration()), token);
  }

  /** Blocking question answering. */
  public AnswerResult answer(
      String question,
      List<ConversationTurn> history,
      GenerationOptions options,
      CancellationToken token) {
    Instant started = clock.instant();
    PreparedRequest request = prepare(question, history, options, token);
    token.throwIfCancelled();

    String answer = generationClient.generate(request.prompt(), options);
    token.throwIfCancelled();

    AnswerResult result = request.toResult(answer, Duration.between(started, clock.instant()));
    recordAnswer(result);
    return result;
  }

  public Flux<AnswerEvent> answerStream(
      String question, List<ConversationTurn> history, CancellationToken token) {
    return answerStream(
        question, history, GenerationOptions.from(properties.getGeneration()), token);
  }

  /**
   * Streaming question answering: content events as fragments arrive, then one sources event and
   * one complete event. Cancellation is checked before every fragment is forwarded.
   */
  public Flux<AnswerEvent> answerStream(
      String question,
      List<ConversationTurn> history,
      GenerationOptions options,
      CancellationToken token) {
    return Flux.defer(
        () -> {
          Instant started = clock.instant();
          PreparedRequest request = prepare(question, history, options, token);
          StringBuilder answer = new StringBuilder();

          Flux<AnswerEvent> content =
              generationClient
                  .generateStream(request.prompt(), options)
                  .<String>handle(
                      (fragment, sink) -> {
                        if (token.isCancelled()) {
                          sink.error(
                              new OperationCancelledException(token.getId(), token.getReason()));
                          return;
                        }
                        sink.next(fragment);
                      })
                  .doOnNext(answer::append)
                  .map(AnswerEvent::content);

          Mono<AnswerEvent> sources =
              Mono.fromSupplier(() -> AnswerEvent.sources(request.sources()));
          Mono<AnswerEvent> complete =
              Mono.fromSupplier(
                  () -> {
                    AnswerResult result =
                        request.toResult(
                            answer.toString(), Duration.between(started, clock.instant()));
                    recordAnswer(result);
                    return AnswerEvent.complete(result);
                  });
          return content.concatWith(sources).concatWith(complete);
        });
  }

  private PreparedRequest prepare(
      String question,
      List<ConversationTurn> history,
      GenerationOptions options,
      CancellationToken token) {
    if (question == null || question.isBlank()) {
      throw new InvalidParameterException("question", question, "non-blank text");
    }
    options.validate();
    String trimmed = question.trim();
    token.throwIfCancelled();

    var retrieval = properties.getRetrieval();
    List<RetrievedChunk> retrieved =
        retriever.retrieve(trimmed, retrieval.getTopK(), retrieval.getMinSimilarity());
    token.throwIfCancelled();

    List<ConversationTurn> recent = recentHistory(history, retrieval.getHistoryTurns());
    PromptBuilder.Context context =
        PromptBuilder.assembleContext(retrieved, retrieval.getMaxContextLength());
    if (context.isEmpty()) {
      log.info("No relevant context for question, answering ungrounded");
      return new PreparedRequest(trimmed, PromptBuilder.ungrounded(trimmed, recent), List.of());
    }
    log.info(
        "Answering grounded on {} of {} retrieved chunk(s)",
        context.included().size(),
        retrieved.size());
    return new PreparedRequest(
        trimmed, PromptBuilder.grounded(trimmed, context.text(), recent), context.included());
  }

  private static List<ConversationTurn> recentHistory(List<ConversationTurn> history, int turns) {
    if (history == null || history.isEmpty()) {
      return List.of();
    }
    return List.copyOf(history.subList(Math.max(0, history.size() - turns), history.size()));
  }

  private void recordAnswer(AnswerResult result) {
    meterRegistry
        .counter("rag.answers", "mode", result.grounded() ? "grounded" : "ungrounded")
        .increment();
    meterRegistry.timer("rag.answer.duration").record(result.processingTime());
    log.info(
        "Answer complete in {} ms: {} source(s), {} chars, confidence {}",
        result.processingTime().toMillis(),
        result.sources().size(),
        result.answer().length(),
        result.confidence());
  }

  private record PreparedRequest(String query, String prompt, List<RetrievedChunk> context) {

    boolean grounded() {
      return !context.isEmpty();
    }

    List<SourceAttribution> sources() {
      return context.stream().map(SourceAttribution::of).toList();
    }

    AnswerResult toResult(String answer, Duration elapsed) {
      return new AnswerResult(
          query,
          answer,
          sources(),
          elapsed,
          ConfidenceCalculator.score(context, answer),
          grounded());
    }
  }
}
