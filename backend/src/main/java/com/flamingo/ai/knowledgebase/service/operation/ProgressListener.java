package com.flamingo.ai.knowledgebase.service.operation;

/** Receives throttled progress updates. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = info -> {};

  void onProgress(ProgressInfo info);
}
