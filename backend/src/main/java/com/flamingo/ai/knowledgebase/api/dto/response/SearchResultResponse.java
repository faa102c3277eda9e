package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one retrieved chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private String chunkId;
  private String filename;
  private int chunkIndex;
  private double distance;
  private double similarity;
  private String content;

  public static SearchResultResponse from(RetrievedChunk chunk) {
    return SearchResultResponse.builder()
        .chunkId(chunk.id())
        .filename(chunk.filename())
        .chunkIndex(chunk.chunkIndex())
        .distance(chunk.distance())
        .similarity(chunk.similarity())
        .content(chunk.content())
        .build();
  }
}
