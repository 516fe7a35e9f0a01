package com.flamingo.ai.site2rag.service.enrichment.model;

/** Whitespace word counting shared by segmentation, windowing and batching. */
public final class WordCounter {

  private WordCounter() {}

  public static int count(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.trim().split("\\s+").length;
  }
}
