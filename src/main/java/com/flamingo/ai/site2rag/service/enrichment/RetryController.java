package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.exception.SessionSetupException;
import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchResult;
import com.flamingo.ai.site2rag.service.enrichment.model.CancellationToken;
import com.flamingo.ai.site2rag.service.enrichment.model.PipelineState;
import com.flamingo.ai.site2rag.service.enrichment.model.ValidationOutcome;
import com.flamingo.ai.site2rag.service.session.EnrichmentSession;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drives a batch to completion: retries the blocks that failed validation, or the whole batch on a
 * call failure, up to the configured number of retries. Blocks that never validate fall back to
 * their original text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryController {

  private final BatchEnhancer batchEnhancer;
  private final EnrichmentConfig enrichmentConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a batch with retries.
   *
   * @param session session holding the active window context
   * @param batch keyed blocks to enrich
   * @param cancellationToken stops further attempts once cancelled
   * @return final text of every block of the batch
   * @throws SessionSetupException if the session cannot take calls
   */
  public BatchResult process(
      EnrichmentSession session, Batch batch, CancellationToken cancellationToken) {
    int maxRetries = Math.max(0, enrichmentConfig.getRetry().getMaxRetries());
    Map<String, String> accepted = new LinkedHashMap<>();
    Batch pending = batch;
    int attempts = 0;

    while (!pending.isEmpty() && attempts <= maxRetries) {
      if (cancellationToken.isCancelled()) {
        log.debug("Session {} - cancelled, {} blocks left", session.getId(), pending.size());
        break;
      }
      if (attempts > 0) {
        meterRegistry.counter("enrichment.batch.retries").increment();
        log.info(
            "Session {} -> {}: retry {}/{} for {} blocks",
            session.getId(),
            PipelineState.RETRYING,
            attempts,
            maxRetries,
            pending.size());
        if (!backoff(attempts)) {
          break;
        }
      }
      attempts++;

      try {
        ValidationOutcome outcome = batchEnhancer.enhance(session, pending);
        accepted.putAll(outcome.validated());
        pending = pending.subset(outcome.failedKeys());
      } catch (SessionSetupException e) {
        throw e;
      } catch (RuntimeException e) {
        meterRegistry
            .counter("enrichment.batch.failures", "type", e.getClass().getSimpleName())
            .increment();
        log.warn(
            "Session {} - attempt {} failed for {} blocks: {}",
            session.getId(),
            attempts,
            pending.size(),
            e.getMessage());
      }
    }

    return toResult(batch, accepted, attempts);
  }

  private BatchResult toResult(Batch batch, Map<String, String> accepted, int attempts) {
    Map<String, String> texts = new LinkedHashMap<>();
    List<String> fallbackKeys = new ArrayList<>();
    batch
        .blocks()
        .forEach(
            (key, original) -> {
              String enhanced = accepted.get(key);
              if (enhanced == null) {
                texts.put(key, original);
                fallbackKeys.add(key);
              } else {
                texts.put(key, enhanced);
              }
            });
    if (!fallbackKeys.isEmpty()) {
      log.warn("Falling back to original text for {}", fallbackKeys);
    }
    return new BatchResult(texts, fallbackKeys, attempts);
  }

  /** Sleeps before retry n; returns false if interrupted. */
  private boolean backoff(int retry) {
    long delay = enrichmentConfig.getRetry().getBackoffMs() * retry;
    if (delay <= 0) {
      return true;
    }
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during retry backoff");
      return false;
    }
  }
}
