package com.flamingo.ai.site2rag.service.enrichment.model;

/** Receives progress after each completed batch. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NO_OP = (processed, total) -> {};

  /**
   * @param processed eligible blocks finalized so far
   * @param total eligible blocks of the document
   */
  void onProgress(int processed, int total);
}
