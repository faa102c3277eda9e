package com.flamingo.ai.knowledgebase.service.rag;

import java.util.List;

/**
 * One element of a streamed answer: content fragments, then the sources, then completion.
 *
 * <p>Only the field matching {@link #type()} is set.
 */
public record AnswerEvent(
    Type type, String content, List<SourceAttribution> sources, AnswerResult result) {

  /** Kind of streamed event. */
  public enum Type {
    CONTENT,
    SOURCES,
    COMPLETE
  }

  public static AnswerEvent content(String fragment) {
    return new AnswerEvent(Type.CONTENT, fragment, null, null);
  }

  public static AnswerEvent sources(List<SourceAttribution> sources) {
    return new AnswerEvent(Type.SOURCES, null, List.copyOf(sources), null);
  }

  public static AnswerEvent complete(AnswerResult result) {
    return new AnswerEvent(Type.COMPLETE, null, null, result);
  }
}
