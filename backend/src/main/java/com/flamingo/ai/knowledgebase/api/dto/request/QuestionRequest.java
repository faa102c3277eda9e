package com.flamingo.ai.knowledgebase.api.dto.request;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.generation.GenerationOptions;
import com.flamingo.ai.knowledgebase.service.rag.ConversationTurn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 10000, message = "Question must not exceed 10000 characters")
  private String question;

  /** Earlier turns of the conversation, oldest first. */
  @Valid @Builder.Default private List<Turn> history = new ArrayList<>();

  /** Optional overrides of the configured generation parameters. */
  private Double temperature;

  private Double topP;
  private Integer topK;
  private Integer maxTokens;

  /** Id under which the operation can be cancelled; generated when absent. */
  private String operationId;

  public List<ConversationTurn> toHistory() {
    if (history == null) {
      return List.of();
    }
    return history.stream().map(turn -> new ConversationTurn(turn.question, turn.answer)).toList();
  }

  /** Configured defaults with this request's overrides applied. */
  public GenerationOptions toOptions(KnowledgeBaseProperties.Generation defaults) {
    return new GenerationOptions(
        temperature != null ? temperature : defaults.getTemperature(),
        topP != null ? topP : defaults.getTopP(),
        topK != null ? topK : defaults.getTopK(),
        maxTokens != null ? maxTokens : defaults.getMaxTokens(),
        defaults.getStop());
  }

  /** One question/answer exchange. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Turn {
    @NotBlank private String question;
    private String answer;
  }
}
