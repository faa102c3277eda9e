package com.flamingo.ai.knowledgebase.domain;

/** Lifecycle of the knowledge base index as seen by the configuration layer. */
public enum IndexStatus {
  NOT_CREATED,
  CREATING,
  CREATED,
  ERROR
}
