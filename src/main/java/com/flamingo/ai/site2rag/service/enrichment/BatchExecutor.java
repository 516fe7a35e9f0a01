package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchResult;
import com.flamingo.ai.site2rag.service.enrichment.model.CancellationToken;
import com.flamingo.ai.site2rag.service.enrichment.model.WindowResult;
import com.flamingo.ai.site2rag.service.session.EnrichmentSession;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the batches of one window concurrently on the enrichment pool. Batch starts are staggered to
 * smooth request bursts; the session's concurrency gate bounds the calls actually in flight.
 */
@Component
@Slf4j
public class BatchExecutor {

  private final RetryController retryController;
  private final EnrichmentConfig enrichmentConfig;
  private final Executor executor;

  public BatchExecutor(
      RetryController retryController,
      EnrichmentConfig enrichmentConfig,
      @Qualifier("enrichmentExecutor") Executor executor) {
    this.retryController = retryController;
    this.enrichmentConfig = enrichmentConfig;
    this.executor = executor;
  }

  /**
   * Dispatches all batches and waits for them.
   *
   * @param session session holding the window context
   * @param batches batches of the window, in document order
   * @param cancellationToken batches not yet started when cancelled fall back to original text
   * @param progressTracker notified after each batch
   * @return merged texts in batch order
   * @throws com.flamingo.ai.site2rag.exception.SessionSetupException if the session fails
   */
  public WindowResult execute(
      EnrichmentSession session,
      List<Batch> batches,
      CancellationToken cancellationToken,
      ProgressTracker progressTracker) {
    if (batches.isEmpty()) {
      return WindowResult.empty();
    }

    List<CompletableFuture<BatchResult>> futures = new ArrayList<>(batches.size());
    for (int i = 0; i < batches.size(); i++) {
      Batch batch = batches.get(i);
      long delay = staggerDelay(i);
      futures.add(
          dispatch(() -> runBatch(session, batch, delay, cancellationToken, progressTracker)));
    }

    Map<String, String> texts = new LinkedHashMap<>();
    List<String> fallbackKeys = new ArrayList<>();
    int attempts = 0;
    for (CompletableFuture<BatchResult> future : futures) {
      BatchResult result = join(future);
      texts.putAll(result.texts());
      fallbackKeys.addAll(result.fallbackKeys());
      attempts += result.attempts();
    }
    return new WindowResult(texts, fallbackKeys, batches.size(), attempts);
  }

  private BatchResult runBatch(
      EnrichmentSession session,
      Batch batch,
      long delay,
      CancellationToken cancellationToken,
      ProgressTracker progressTracker) {
    if (delay > 0 && !sleep(delay)) {
      cancellationToken.cancel();
    }
    BatchResult result =
        cancellationToken.isCancelled()
            ? new BatchResult(batch.blocks(), batch.keys(), 0)
            : retryController.process(session, batch, cancellationToken);
    progressTracker.completed(result.texts().keySet());
    return result;
  }

  /** Submits a batch to the pool, running it on the calling thread when the pool is saturated. */
  private CompletableFuture<BatchResult> dispatch(Supplier<BatchResult> task) {
    try {
      return CompletableFuture.supplyAsync(task, executor);
    } catch (RejectedExecutionException e) {
      log.warn("Enrichment pool saturated, running batch on the calling thread");
      try {
        return CompletableFuture.completedFuture(task.get());
      } catch (RuntimeException failure) {
        return CompletableFuture.failedFuture(failure);
      }
    }
  }

  long staggerDelay(int batchIndex) {
    EnrichmentConfig.Batching config = enrichmentConfig.getBatching();
    return Math.min(config.getStaggerCapMs(), batchIndex * config.getStaggerStepMs());
  }

  private static boolean sleep(long delay) {
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static BatchResult join(CompletableFuture<BatchResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }
}
