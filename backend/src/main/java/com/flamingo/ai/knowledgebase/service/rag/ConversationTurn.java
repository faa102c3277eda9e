package com.flamingo.ai.knowledgebase.service.rag;

/** One earlier question and the answer given to it. */
public record ConversationTurn(String question, String answer) {}
