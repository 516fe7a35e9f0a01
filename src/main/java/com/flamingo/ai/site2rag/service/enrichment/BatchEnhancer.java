package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;
import com.flamingo.ai.site2rag.service.enrichment.model.ValidationOutcome;
import com.flamingo.ai.site2rag.service.session.EnrichmentSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Sends one batch through a session and validates what comes back. */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchEnhancer {

  private final EnhancementValidator enhancementValidator;

  /**
   * Makes a single enrichment attempt for a batch.
   *
   * @param session session holding the active window context
   * @param batch keyed blocks to enrich
   * @return validated texts and the keys that need another attempt
   * @throws com.flamingo.ai.site2rag.exception.LlmServiceException on transport failure
   * @throws com.flamingo.ai.site2rag.exception.InvalidResponseShapeException on malformed output
   */
  public ValidationOutcome enhance(EnrichmentSession session, Batch batch) {
    String prompt = EnrichmentPrompts.batchPrompt(batch);
    BatchEnhancementResponse response = session.call(prompt);
    ValidationOutcome outcome = enhancementValidator.validateBatch(batch, response);
    log.debug(
        "Session {} - batch of {} blocks: {} valid, {} failed",
        session.getId(),
        batch.size(),
        outcome.validated().size(),
        outcome.failedKeys().size());
    return outcome;
  }
}
