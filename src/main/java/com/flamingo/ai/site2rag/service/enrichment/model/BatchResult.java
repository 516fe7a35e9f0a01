package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final text of every block of a batch after retries.
 *
 * @param texts key to final text (enhanced, or original for fallback blocks)
 * @param fallbackKeys keys that never validated and carry their original text
 * @param attempts number of provider attempts made
 */
public record BatchResult(Map<String, String> texts, List<String> fallbackKeys, int attempts) {

  public BatchResult {
    texts = Collections.unmodifiableMap(new LinkedHashMap<>(texts));
    fallbackKeys = List.copyOf(fallbackKeys);
  }

  public int enhancedCount() {
    return texts.size() - fallbackKeys.size();
  }
}
