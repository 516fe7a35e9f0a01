package com.flamingo.ai.site2rag.service.enrichment.model;

/** Metadata of the document being enriched, included in the cached instructions. */
public record DocumentMetadata(String title, String url, String description) {

  public static DocumentMetadata empty() {
    return new DocumentMetadata(null, null, null);
  }
}
