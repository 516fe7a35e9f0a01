package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Map;

/** Structured provider response: enhanced text per block key. */
public record BatchEnhancementResponse(Map<String, String> enhancedBlocks) {

  public BatchEnhancementResponse {
    enhancedBlocks = Map.copyOf(enhancedBlocks);
  }
}
