package com.flamingo.ai.site2rag.service.session;

import com.flamingo.ai.site2rag.exception.LlmServiceException;
import com.flamingo.ai.site2rag.exception.SessionSetupException;
import com.flamingo.ai.site2rag.service.enrichment.EnrichmentPrompts;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;
import com.flamingo.ai.site2rag.service.enrichment.model.CacheMetrics;
import com.flamingo.ai.site2rag.service.enrichment.provider.EnrichmentProvider;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Enrichment session of one document run.
 *
 * <p>Holds the static instructions set at creation and the text of the active window. Together
 * they form the cached context every batch call of the window is made against. The window context
 * has a single writer (window setup) and many readers (concurrent batch calls). A semaphore shared
 * by all calls bounds the number of in-flight provider requests.
 */
@Slf4j
public class EnrichmentSession {

  private final String id;
  private final String staticContext;
  private final EnrichmentProvider provider;
  private final Semaphore gate;
  private final int concurrencyLimit;
  private final Clock clock;

  private volatile String cachedContext;
  private volatile Instant lastUsed;
  private volatile boolean closed;

  private final AtomicBoolean windowServed = new AtomicBoolean();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong tokensSaved = new AtomicLong();

  EnrichmentSession(
      String id,
      String staticContext,
      EnrichmentProvider provider,
      int concurrencyLimit,
      Clock clock) {
    if (staticContext == null || staticContext.isBlank()) {
      throw new SessionSetupException(id, "Session " + id + " has no instructions");
    }
    if (concurrencyLimit < 1) {
      throw new SessionSetupException(
          id, "Concurrency limit must be at least 1, got " + concurrencyLimit);
    }
    this.id = id;
    this.staticContext = staticContext;
    this.provider = provider;
    this.concurrencyLimit = concurrencyLimit;
    this.gate = new Semaphore(concurrencyLimit, true);
    this.clock = clock;
    this.lastUsed = clock.instant();
  }

  public String getId() {
    return id;
  }

  public int getConcurrencyLimit() {
    return concurrencyLimit;
  }

  public Instant getLastUsed() {
    return lastUsed;
  }

  public boolean isClosed() {
    return closed;
  }

  /** Current cached context, or {@code null} before the first window is set. */
  public String getCachedContext() {
    return cachedContext;
  }

  /**
   * Replaces the window part of the cached context. Must be called before the window's batches are
   * dispatched and not while they are in flight.
   *
   * @throws SessionSetupException if the session is closed or the window text is empty
   */
  public void setWindowContext(int windowIndex, String windowText) {
    ensureOpen();
    if (windowText == null || windowText.isBlank()) {
      throw new SessionSetupException(id, "Window " + (windowIndex + 1) + " has no text");
    }
    this.cachedContext = EnrichmentPrompts.cachedContext(staticContext, windowIndex, windowText);
    windowServed.set(false);
    touch();
    log.debug(
        "Session {} - window {} context set: {} chars (~{} tokens)",
        id,
        windowIndex + 1,
        cachedContext.length(),
        estimateTokens(cachedContext));
  }

  /**
   * Calls the provider with one batch prompt against the cached context. Waits for a permit of the
   * session's concurrency gate first.
   *
   * <p>The first successful call after a window change counts as a cache miss, every later one as a
   * hit.
   *
   * @throws SessionSetupException if the session is closed or no window context is set
   */
  public BatchEnhancementResponse call(String prompt) {
    ensureOpen();
    String context = cachedContext;
    if (context == null) {
      throw new SessionSetupException(id, "Session " + id + " has no window context");
    }

    try {
      gate.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmServiceException("Interrupted while waiting for a call permit", e);
    }
    try {
      touch();
      BatchEnhancementResponse response = provider.enhance(context, prompt);
      recordCacheUse(context);
      return response;
    } finally {
      gate.release();
    }
  }

  /** Calls currently holding a permit. */
  public int inFlightCalls() {
    return concurrencyLimit - gate.availablePermits();
  }

  public CacheMetrics metrics() {
    return new CacheMetrics(hits.get(), misses.get(), tokensSaved.get());
  }

  /** Marks the session closed and returns its final metrics. */
  CacheMetrics close() {
    closed = true;
    return metrics();
  }

  private void recordCacheUse(String context) {
    if (windowServed.compareAndSet(false, true)) {
      misses.incrementAndGet();
    } else {
      hits.incrementAndGet();
      tokensSaved.addAndGet(estimateTokens(context));
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new SessionSetupException(id, "Session " + id + " is closed");
    }
  }

  private void touch() {
    lastUsed = clock.instant();
  }

  private static long estimateTokens(String text) {
    return (text.length() + 3) / 4;
  }
}
