package com.flamingo.ai.knowledgebase.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for switching the embedding model. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingModelRequest {

  @NotBlank(message = "Model is required")
  private String model;
}
