package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.service.collection.InsertResult;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an indexed document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String documentId;
  private int chunkCount;
  private int dimension;
  private EmbeddingSource embeddingSource;

  public static DocumentResponse from(InsertResult result) {
    return DocumentResponse.builder()
        .documentId(result.documentId())
        .chunkCount(result.chunkCount())
        .dimension(result.dimension())
        .embeddingSource(result.embeddingSource())
        .build();
  }
}
