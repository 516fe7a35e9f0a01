package com.flamingo.ai.site2rag.service.enrichment.model;

/**
 * Immutable block of the document stream.
 *
 * @param key sequential key such as {@code BLOCK_001}; {@code null} for pass-through blocks that
 *     are never sent to the model
 * @param text original block text
 * @param originalIndex position in the input stream
 * @param wordCount number of whitespace-separated words
 */
public record ContentBlock(String key, String text, int originalIndex, int wordCount) {

  public boolean isEligible() {
    return key != null;
  }
}
