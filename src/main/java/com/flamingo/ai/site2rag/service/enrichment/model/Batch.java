package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered keyed blocks sent in one enrichment call. Immutable: a retry builds a new batch with
 * {@link #subset(List)}.
 */
public record Batch(Map<String, String> blocks, int wordCount) {

  public Batch {
    blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
  }

  public static Batch of(Map<String, String> blocks) {
    int words = blocks.values().stream().mapToInt(WordCounter::count).sum();
    return new Batch(blocks, words);
  }

  /** Returns a new batch holding only the given keys, in this batch's order. */
  public Batch subset(List<String> keys) {
    Map<String, String> selected = new LinkedHashMap<>();
    blocks.forEach(
        (key, text) -> {
          if (keys.contains(key)) {
            selected.put(key, text);
          }
        });
    return of(selected);
  }

  public List<String> keys() {
    return List.copyOf(blocks.keySet());
  }

  public int size() {
    return blocks.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
