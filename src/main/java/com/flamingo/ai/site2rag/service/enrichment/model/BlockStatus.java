package com.flamingo.ai.site2rag.service.enrichment.model;

/** How the text of an output block was obtained. */
public enum BlockStatus {
  /** Validated model output carrying at least one inserted annotation. */
  ENHANCED,
  /** Validated model output that added nothing. */
  UNCHANGED,
  /** Original text after the block never validated. */
  FALLBACK,
  /** Too short to be sent to the model. */
  PASS_THROUGH
}
