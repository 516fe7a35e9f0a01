package com.flamingo.ai.site2rag.service.enrichment.model;

/**
 * A block handed over by the upstream parser: paragraph, heading, list or code, in document order.
 *
 * @param text the markdown text of the block
 * @param type optional block type reported by the parser (e.g. "paragraph", "heading")
 */
public record SourceBlock(String text, String type) {

  public SourceBlock {
    text = text == null ? "" : text;
  }

  public static SourceBlock of(String text) {
    return new SourceBlock(text, null);
  }
}
