package com.flamingo.ai.site2rag.service.enrichment.provider;

import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;

/**
 * Boundary to the AI provider. Implementations are selected by configuration; the pipeline depends
 * only on this interface.
 */
public interface EnrichmentProvider {

  /**
   * Sends one batch prompt against the cached context.
   *
   * @param cachedContext instructions, metadata and window text shared by every batch of a window
   * @param batchPrompt keyed blocks of one batch
   * @return enhanced text per block key
   * @throws com.flamingo.ai.site2rag.exception.InvalidResponseShapeException if the response is not
   *     the expected JSON object
   * @throws com.flamingo.ai.site2rag.exception.LlmServiceException on transport errors and timeouts
   */
  BatchEnhancementResponse enhance(String cachedContext, String batchPrompt);
}
