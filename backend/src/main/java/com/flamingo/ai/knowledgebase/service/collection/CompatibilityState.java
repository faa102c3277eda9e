package com.flamingo.ai.knowledgebase.service.collection;

/** Result of comparing the active embedding model with the stored collection. */
public enum CompatibilityState {
  /** No collection existed; a fresh one was created. */
  CREATED,
  COMPATIBLE,
  /** Stored vectors had another length; the collection was dropped and created again. */
  RECREATED,
  /** The active model could not be probed; nothing was changed. */
  UNKNOWN
}
