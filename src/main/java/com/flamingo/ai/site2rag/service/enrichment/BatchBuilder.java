package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Groups a window's blocks into batches near the target word count without splitting a block. */
@Component
@RequiredArgsConstructor
public class BatchBuilder {

  private final EnrichmentConfig enrichmentConfig;

  public List<Batch> buildBatches(List<ContentBlock> blocks) {
    return buildBatches(blocks, enrichmentConfig.getBatching().getTargetBatchWords());
  }

  /**
   * Accumulates blocks in order and starts a new batch when the next block would exceed the target.
   * A block larger than the target forms a batch of its own.
   *
   * @param blocks keyed blocks in document order
   * @param targetWords target words per batch
   * @return batches in document order
   */
  public List<Batch> buildBatches(List<ContentBlock> blocks, int targetWords) {
    List<Batch> batches = new ArrayList<>();
    Map<String, String> current = new LinkedHashMap<>();
    int currentWords = 0;

    for (ContentBlock block : blocks) {
      if (!block.isEligible()) {
        continue;
      }
      if (!current.isEmpty() && currentWords + block.wordCount() > targetWords) {
        batches.add(new Batch(current, currentWords));
        current = new LinkedHashMap<>();
        currentWords = 0;
      }
      current.put(block.key(), block.text());
      currentWords += block.wordCount();
    }

    if (!current.isEmpty()) {
      batches.add(new Batch(current, currentWords));
    }
    return batches;
  }
}
