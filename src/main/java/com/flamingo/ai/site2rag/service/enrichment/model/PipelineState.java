package com.flamingo.ai.site2rag.service.enrichment.model;

/** States a document run moves through. */
public enum PipelineState {
  INIT,
  SEGMENTED,
  WINDOWS_PLANNED,
  CACHE_SET,
  BATCHES_DISPATCHED,
  VALIDATED,
  RETRYING,
  MERGED,
  REASSEMBLED,
  DONE,
  CANCELLED,
  FAILED
}
