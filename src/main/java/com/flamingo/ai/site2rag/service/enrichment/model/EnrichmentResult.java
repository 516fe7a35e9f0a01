package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.List;

/** Enriched document: one {@link EnhancedBlock} per input block, in input order. */
public record EnrichmentResult(List<EnhancedBlock> blocks, EnrichmentSummary summary) {

  public EnrichmentResult {
    blocks = List.copyOf(blocks);
  }
}
