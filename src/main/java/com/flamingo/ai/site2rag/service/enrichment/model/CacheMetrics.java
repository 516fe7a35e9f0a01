package com.flamingo.ai.site2rag.service.enrichment.model;

/**
 * Cached-context usage of a session.
 *
 * @param hits calls made while the window context had already served a call
 * @param misses first calls after each window context change
 * @param estimatedTokensSaved context tokens not resent thanks to hits (chars / 4 estimate)
 */
public record CacheMetrics(long hits, long misses, long estimatedTokensSaved) {

  public static CacheMetrics empty() {
    return new CacheMetrics(0, 0, 0);
  }

  /** Hit rate in percent, 0 when no call was made. */
  public double hitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : hits * 100.0 / total;
  }
}
