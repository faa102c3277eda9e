package com.flamingo.ai.knowledgebase.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledgebase.api.dto.request.QuestionRequest;
import com.flamingo.ai.knowledgebase.api.dto.request.SearchRequest;
import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledgebase.exception.NoRelevantDocumentsException;
import com.flamingo.ai.knowledgebase.service.generation.GenerationOptions;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.rag.AnswerResult;
import com.flamingo.ai.knowledgebase.service.rag.RagOrchestrator;
import com.flamingo.ai.knowledgebase.service.rag.SourceAttribution;
import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import com.flamingo.ai.knowledgebase.service.retrieval.Retriever;
import com.flamingo.ai.knowledgebase.support.MutableClock;
import com.flamingo.ai.knowledgebase.vectorstore.StoredChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuestionController Tests")
class QuestionControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private RagOrchestrator ragOrchestrator;
  @Mock private Retriever retriever;

  @BeforeEach
  void setUp() {
    CancellationRegistry cancellationRegistry =
        new CancellationRegistry(MutableClock.startingAtEpoch(), Duration.ofHours(1));
    QuestionController controller =
        new QuestionController(
            ragOrchestrator, retriever, cancellationRegistry, new KnowledgeBaseProperties());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should answer with sources and confidence")
  void shouldAnswerQuestion() throws Exception {
    QuestionRequest request =
        QuestionRequest.builder()
            .question("What is the travel budget?")
            .history(List.of(new QuestionRequest.Turn("Who approves trips?", "Your manager.")))
            .temperature(0.2)
            .build();
    AnswerResult result =
        new AnswerResult(
            "What is the travel budget?",
            "5000 EUR per quarter.",
            List.of(new SourceAttribution("travel-policy.txt", 0, 0.12, "The quarterly...")),
            Duration.ofMillis(250),
            0.74,
            true);
    when(ragOrchestrator.answer(
            eq("What is the travel budget?"),
            anyList(),
            any(GenerationOptions.class),
            any(CancellationToken.class)))
        .thenReturn(result);

    mockMvc
        .perform(
            post("/api/questions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.answer").value("5000 EUR per quarter."))
        .andExpect(jsonPath("$.sources[0].filename").value("travel-policy.txt"))
        .andExpect(jsonPath("$.confidence").value(0.74))
        .andExpect(jsonPath("$.processingTimeMs").value(250));
  }

  @Test
  @DisplayName("Should reject a blank question before answering")
  void shouldRejectBlankQuestion() throws Exception {
    QuestionRequest request = QuestionRequest.builder().question(" ").build();

    mockMvc
        .perform(
            post("/api/questions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verifyNoInteractions(ragOrchestrator);
  }

  @Test
  @DisplayName("Should return matching chunks")
  void shouldSearch() throws Exception {
    SearchRequest request = SearchRequest.builder().query("travel budget").topK(3).build();
    when(retriever.retrieveRequired("travel budget", 3, 0.0))
        .thenReturn(
            List.of(
                new RetrievedChunk(
                    "doc-1_0",
                    "The quarterly travel budget is 5000 EUR.",
                    Map.of(StoredChunk.FILENAME, "travel-policy.txt", StoredChunk.CHUNK_INDEX, 0),
                    0.1)));

    mockMvc
        .perform(
            post("/api/questions/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].filename").value("travel-policy.txt"))
        .andExpect(jsonPath("$[0].content").value("The quarterly travel budget is 5000 EUR."));
  }

  @Test
  @DisplayName("Should return 404 when nothing is relevant")
  void shouldReturnNotFoundWhenNothingRelevant() throws Exception {
    SearchRequest request = SearchRequest.builder().query("weather").build();
    when(retriever.retrieveRequired("weather", 5, 0.0))
        .thenThrow(new NoRelevantDocumentsException("weather", 0.0));

    mockMvc
        .perform(
            post("/api/questions/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("QA_001"));
  }
}
