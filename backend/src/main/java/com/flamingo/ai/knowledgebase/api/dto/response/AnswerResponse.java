package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.service.rag.AnswerResult;
import com.flamingo.ai.knowledgebase.service.rag.SourceAttribution;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a generated answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

  private String query;
  private String answer;
  private List<SourceAttribution> sources;
  private long processingTimeMs;
  private double confidence;
  private boolean grounded;

  public static AnswerResponse from(AnswerResult result) {
    return AnswerResponse.builder()
        .query(result.query())
        .answer(result.answer())
        .sources(result.sources())
        .processingTimeMs(result.processingTime().toMillis())
        .confidence(result.confidence())
        .grounded(result.grounded())
        .build();
  }
}
