package com.flamingo.ai.site2rag.service.enrichment.model;

import lombok.Builder;

/** Observability counts of one document run. */
@Builder
public record EnrichmentSummary(
    int totalBlocks,
    int eligibleBlocks,
    int enhancedBlocks,
    int unchangedBlocks,
    int fallbackBlocks,
    int passThroughBlocks,
    int annotations,
    int windows,
    int batches,
    CacheMetrics cacheMetrics,
    long durationMs,
    boolean cancelled) {}
