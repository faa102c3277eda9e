package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.service.rag.AnswerEvent;
import com.flamingo.ai.knowledgebase.service.rag.SourceAttribution;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE answer streaming. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamEventResponse {

  /** Event type: operation, token, sources, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** First event of a stream, carrying the id to cancel it with. */
  public static StreamEventResponse operation(String operationId) {
    return StreamEventResponse.builder()
        .eventType("operation")
        .data(new OperationData(operationId))
        .build();
  }

  public static StreamEventResponse from(AnswerEvent event) {
    return switch (event.type()) {
      case CONTENT -> StreamEventResponse.builder()
          .eventType("token")
          .data(new TokenData(event.content()))
          .build();
      case SOURCES -> StreamEventResponse.builder()
          .eventType("sources")
          .data(new SourcesData(event.sources()))
          .build();
      case COMPLETE -> StreamEventResponse.builder()
          .eventType("done")
          .data(AnswerResponse.from(event.result()))
          .build();
    };
  }

  public static StreamEventResponse error(String code, String message) {
    return StreamEventResponse.builder()
        .eventType("error")
        .data(new ErrorData(code, message))
        .build();
  }

  /** Operation event data. */
  @Data
  @AllArgsConstructor
  public static class OperationData {
    private String operationId;
  }

  /** Token event data. */
  @Data
  @AllArgsConstructor
  public static class TokenData {
    private String content;
  }

  /** Sources event data. */
  @Data
  @AllArgsConstructor
  public static class SourcesData {
    private List<SourceAttribution> sources;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String code;
    private String message;
  }
}
