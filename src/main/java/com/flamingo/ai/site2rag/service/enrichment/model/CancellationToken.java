package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External abort signal for a document run. Once cancelled, no new batch is dispatched; blocks
 * already enhanced keep their text and the rest fall back to the original.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
