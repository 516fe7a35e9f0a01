package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.List;

/**
 * Contiguous run of eligible blocks sized to the model's usable context.
 *
 * @param index zero-based position in the window sequence
 * @param blocks blocks of the window, in document order
 * @param wordCount total words of the blocks
 */
public record Window(int index, List<ContentBlock> blocks, int wordCount) {

  public Window {
    blocks = List.copyOf(blocks);
  }

  public ContentBlock first() {
    return blocks.get(0);
  }

  public ContentBlock last() {
    return blocks.get(blocks.size() - 1);
  }
}
