package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged outcome of all batches of one window.
 *
 * @param texts key to final text, in document order
 * @param fallbackKeys keys carrying their original text
 * @param batchCount batches dispatched
 * @param attempts provider attempts made across the batches
 */
public record WindowResult(
    Map<String, String> texts, List<String> fallbackKeys, int batchCount, int attempts) {

  public WindowResult {
    texts = Collections.unmodifiableMap(new LinkedHashMap<>(texts));
    fallbackKeys = List.copyOf(fallbackKeys);
  }

  public static WindowResult empty() {
    return new WindowResult(Map.of(), List.of(), 0, 0);
  }
}
