package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of segmentation: every input block in order, plus the ordered key-to-text mapping of the
 * blocks eligible for enrichment.
 */
public record SegmentedDocument(List<ContentBlock> blocks, Map<String, String> keyedBlocks) {

  public SegmentedDocument {
    blocks = List.copyOf(blocks);
    keyedBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(keyedBlocks));
  }

  public List<ContentBlock> eligibleBlocks() {
    return blocks.stream().filter(ContentBlock::isEligible).toList();
  }

  public int eligibleCount() {
    return keyedBlocks.size();
  }

  public int passThroughCount() {
    return blocks.size() - keyedBlocks.size();
  }

  public int eligibleWordCount() {
    return blocks.stream().filter(ContentBlock::isEligible).mapToInt(ContentBlock::wordCount).sum();
  }
}
