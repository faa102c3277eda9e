package com.flamingo.ai.knowledgebase.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for retrieval without generation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  private String query;

  @Min(1)
  @Max(100)
  private Integer topK;

  @Min(0)
  @Max(1)
  private Double minSimilarity;
}
