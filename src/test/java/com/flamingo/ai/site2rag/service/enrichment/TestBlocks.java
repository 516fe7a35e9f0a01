package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Builders for keyed blocks used across pipeline tests. */
final class TestBlocks {

  private TestBlocks() {}

  /** Text of exactly {@code words} words. */
  static String words(int words) {
    return IntStream.range(0, words).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
  }

  /** Keyed block at {@code index} holding {@code words} words. */
  static ContentBlock block(int index, int words) {
    return new ContentBlock(BlockSegmenter.formatKey(index + 1), words(words), index, words);
  }

  /** Keyed blocks with the given word counts, in order. */
  static List<ContentBlock> keyed(int... wordCounts) {
    List<ContentBlock> blocks = new ArrayList<>();
    for (int i = 0; i < wordCounts.length; i++) {
      blocks.add(block(i, wordCounts[i]));
    }
    return blocks;
  }
}
