package com.flamingo.ai.knowledgebase.service.rag;

import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Assembles bounded context and the grounded or ungrounded prompt text. */
@Slf4j
final class PromptBuilder {

  private static final String HISTORY_HEADER = "[Conversation history]\n";

  private static final String GROUNDED_TEMPLATE =
      """
      Use the context below to give an accurate and helpful answer to the user's question.

      [Context]
      %s

      %s[Question]
      %s

      [Instructions]
      - Answer only from the information in the context.
      - If the context does not contain the answer, say explicitly that the provided documents \
      do not contain this information.
      - Cite the file names of the sources you used.
      - Be specific and concise.

      [Answer]
      """;

  private static final String UNGROUNDED_TEMPLATE =
      """
      Answer the following question clearly, based on your general knowledge.

      %s[Question]
      %s

      [Instructions]
      - The knowledge base has no material for this question, so answer from general knowledge.
      - If you do not know the answer, say honestly that you do not know.
      - Be helpful and constructive.

      [Answer]
      """;

  private PromptBuilder() {}

  /** Context text plus the chunks that fit into it. */
  record Context(String text, List<RetrievedChunk> included) {

    boolean isEmpty() {
      return included.isEmpty();
    }
  }

  /**
   * Adds chunks in rank order, each tagged with its file name, and stops before the first one
   * that would exceed the budget. Chunks are never cut.
   */
  static Context assembleContext(List<RetrievedChunk> chunks, int maxLength) {
    List<String> parts = new ArrayList<>();
    List<RetrievedChunk> included = new ArrayList<>();
    int total = 0;
    for (RetrievedChunk chunk : chunks) {
      String part = chunk.content() + "\n[source: " + chunk.filename() + "]\n";
      if (total + part.length() > maxLength) {
        log.debug("Context budget of {} characters reached", maxLength);
        break;
      }
      parts.add(part);
      included.add(chunk);
      total += part.length();
    }
    return new Context(String.join("\n", parts), included);
  }

  static String grounded(String question, String context, List<ConversationTurn> history) {
    return String.format(GROUNDED_TEMPLATE, context, historyBlock(history), question);
  }

  static String ungrounded(String question, List<ConversationTurn> history) {
    return String.format(UNGROUNDED_TEMPLATE, historyBlock(history), question);
  }

  private static String historyBlock(List<ConversationTurn> history) {
    if (history == null || history.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(HISTORY_HEADER);
    for (ConversationTurn turn : history) {
      sb.append("User: ").append(turn.question()).append('\n');
      sb.append("Assistant: ").append(turn.answer()).append('\n');
    }
    return sb.append('\n').toString();
  }
}
