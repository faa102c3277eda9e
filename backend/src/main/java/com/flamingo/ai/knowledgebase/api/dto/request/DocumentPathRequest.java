package com.flamingo.ai.knowledgebase.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO naming a file on the local disk. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPathRequest {

  @NotBlank(message = "Path is required")
  private String path;
}
