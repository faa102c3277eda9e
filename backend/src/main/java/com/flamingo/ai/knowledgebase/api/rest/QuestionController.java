package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.request.QuestionRequest;
import com.flamingo.ai.knowledgebase.api.dto.request.SearchRequest;
import com.flamingo.ai.knowledgebase.api.dto.response.AnswerResponse;
import com.flamingo.ai.knowledgebase.api.dto.response.SearchResultResponse;
import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.rag.AnswerResult;
import com.flamingo.ai.knowledgebase.service.rag.RagOrchestrator;
import com.flamingo.ai.knowledgebase.service.retrieval.Retriever;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for blocking question answering and plain retrieval. */
@RestController
@RequestMapping("/api/questions")
@RequiredArgsConstructor
public class QuestionController {

  private final RagOrchestrator ragOrchestrator;
  private final Retriever retriever;
  private final CancellationRegistry cancellationRegistry;
  private final KnowledgeBaseProperties properties;

  /** Answers a question from the indexed documents. */
  @PostMapping
  public ResponseEntity<AnswerResponse> ask(@Valid @RequestBody QuestionRequest request) {
    CancellationToken token = cancellationRegistry.create(request.getOperationId());
    try {
      AnswerResult result =
          ragOrchestrator.answer(
              request.getQuestion(),
              request.toHistory(),
              request.toOptions(properties.getGeneration()),
              token);
      return ResponseEntity.ok(AnswerResponse.from(result));
    } finally {
      cancellationRegistry.release(token.getId());
    }
  }

  /** Returns the chunks closest to the query; 404 when none clears the threshold. */
  @PostMapping("/search")
  public ResponseEntity<List<SearchResultResponse>> search(
      @Valid @RequestBody SearchRequest request) {
    KnowledgeBaseProperties.Retrieval retrieval = properties.getRetrieval();
    int topK = request.getTopK() != null ? request.getTopK() : retrieval.getTopK();
    double minSimilarity =
        request.getMinSimilarity() != null
            ? request.getMinSimilarity()
            : retrieval.getMinSimilarity();
    List<SearchResultResponse> results =
        retriever.retrieveRequired(request.getQuery(), topK, minSimilarity).stream()
            .map(SearchResultResponse::from)
            .toList();
    return ResponseEntity.ok(results);
  }
}
