package com.flamingo.ai.site2rag.api.dto.response;

import com.flamingo.ai.site2rag.service.enrichment.model.BlockStatus;
import com.flamingo.ai.site2rag.service.enrichment.model.CacheMetrics;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentResult;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentSummary;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an enriched document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichDocumentResponse {

  private List<BlockResponse> blocks;
  private int totalBlocks;
  private int enhancedBlocks;
  private int unchangedBlocks;
  private int fallbackBlocks;
  private int passThroughBlocks;
  private int annotations;
  private int windows;
  private int batches;
  private long cacheHits;
  private long cacheMisses;
  private double cacheHitRate;
  private long estimatedTokensSaved;
  private long durationMs;
  private boolean cancelled;

  /** Output pair of one input block. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class BlockResponse {
    private String original;
    private String enhanced;
    private BlockStatus status;
  }

  /** Creates a response from an enrichment result. */
  public static EnrichDocumentResponse from(EnrichmentResult result) {
    EnrichmentSummary summary = result.summary();
    CacheMetrics cache =
        summary.cacheMetrics() == null ? CacheMetrics.empty() : summary.cacheMetrics();
    return EnrichDocumentResponse.builder()
        .blocks(
            result.blocks().stream()
                .map(
                    block ->
                        BlockResponse.builder()
                            .original(block.original())
                            .enhanced(block.enhanced())
                            .status(block.status())
                            .build())
                .toList())
        .totalBlocks(summary.totalBlocks())
        .enhancedBlocks(summary.enhancedBlocks())
        .unchangedBlocks(summary.unchangedBlocks())
        .fallbackBlocks(summary.fallbackBlocks())
        .passThroughBlocks(summary.passThroughBlocks())
        .annotations(summary.annotations())
        .windows(summary.windows())
        .batches(summary.batches())
        .cacheHits(cache.hits())
        .cacheMisses(cache.misses())
        .cacheHitRate(cache.hitRate())
        .estimatedTokensSaved(cache.estimatedTokensSaved())
        .durationMs(summary.durationMs())
        .cancelled(summary.cancelled())
        .build();
  }
}
