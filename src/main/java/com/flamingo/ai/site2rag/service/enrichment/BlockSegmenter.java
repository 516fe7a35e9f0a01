package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.SegmentedDocument;
import com.flamingo.ai.site2rag.service.enrichment.model.SourceBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.WordCounter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides which blocks are worth sending to the model and keys them.
 *
 * <p>Headers, list markers, brackets and emphasis markers are stripped before measuring a block.
 * Blocks whose remaining text is shorter than the configured minimum (headings, separators, image
 * lines) stay unkeyed and pass through untouched, keeping their position for reassembly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockSegmenter {

  private static final Pattern MARKUP_PUNCTUATION = Pattern.compile("[#*\\-`>\\[\\](){}_]");

  private final EnrichmentConfig enrichmentConfig;

  /**
   * Segments the given blocks.
   *
   * @param sourceBlocks blocks in document order; {@code null} entries are treated as empty
   * @return every block with its original index, and the ordered key-to-text map of eligible ones
   */
  public SegmentedDocument segment(List<SourceBlock> sourceBlocks) {
    int minChars = enrichmentConfig.getSegmentation().getMinBlockChars();
    List<ContentBlock> blocks = new ArrayList<>(sourceBlocks.size());
    Map<String, String> keyedBlocks = new LinkedHashMap<>();

    int keyCounter = 0;
    for (int i = 0; i < sourceBlocks.size(); i++) {
      SourceBlock source = sourceBlocks.get(i);
      String text = source == null ? "" : source.text();

      String key = null;
      if (realTextLength(text) >= minChars) {
        key = formatKey(++keyCounter);
        keyedBlocks.put(key, text);
      }
      blocks.add(new ContentBlock(key, text, i, WordCounter.count(text)));
    }

    log.debug(
        "Segmented {} blocks: {} eligible, {} pass-through (min {} chars)",
        blocks.size(),
        keyedBlocks.size(),
        blocks.size() - keyedBlocks.size(),
        minChars);
    return new SegmentedDocument(blocks, keyedBlocks);
  }

  /** Length of the block text once markup punctuation is removed and the result trimmed. */
  static int realTextLength(String text) {
    if (text == null) {
      return 0;
    }
    return MARKUP_PUNCTUATION.matcher(text).replaceAll("").trim().length();
  }

  static String formatKey(int sequence) {
    return String.format("BLOCK_%03d", sequence);
  }
}
