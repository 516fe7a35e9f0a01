package com.flamingo.ai.site2rag.service.enrichment.model;

/** Output pair for one input block. */
public record EnhancedBlock(String original, String enhanced, BlockStatus status) {}
