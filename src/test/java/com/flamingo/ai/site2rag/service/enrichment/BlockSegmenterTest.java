package com.flamingo.ai.site2rag.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.SegmentedDocument;
import com.flamingo.ai.site2rag.service.enrichment.model.SourceBlock;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BlockSegmenter Tests")
class BlockSegmenterTest {

  private static final String PARAGRAPH =
      "The team shipped the new release after three months of work.";

  private BlockSegmenter segmenter;

  @BeforeEach
  void setUp() {
    segmenter = new BlockSegmenter(new EnrichmentConfig());
  }

  @Test
  @DisplayName("should key long blocks and pass short ones through")
  void shouldKeyEligibleBlocks_whenMixedContent() {
    SegmentedDocument document =
        segmenter.segment(
            List.of(
                SourceBlock.of("# Release notes"),
                SourceBlock.of(PARAGRAPH),
                SourceBlock.of("---"),
                SourceBlock.of("It also fixed the login bug reported by several users.")));

    assertThat(document.blocks()).hasSize(4);
    assertThat(document.blocks())
        .extracting(ContentBlock::key)
        .containsExactly(null, "BLOCK_001", null, "BLOCK_002");
    assertThat(document.keyedBlocks()).containsOnlyKeys("BLOCK_001", "BLOCK_002");
    assertThat(document.keyedBlocks().get("BLOCK_001")).isEqualTo(PARAGRAPH);
    assertThat(document.eligibleCount()).isEqualTo(2);
    assertThat(document.passThroughCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("should keep original index and word count of every block")
  void shouldKeepPositions_whenSegmenting() {
    SegmentedDocument document =
        segmenter.segment(List.of(SourceBlock.of("## Intro"), SourceBlock.of(PARAGRAPH)));

    assertThat(document.blocks()).extracting(ContentBlock::originalIndex).containsExactly(0, 1);
    assertThat(document.blocks().get(1).wordCount()).isEqualTo(11);
    assertThat(document.eligibleWordCount()).isEqualTo(11);
  }

  @Test
  @DisplayName("should treat null entries as empty pass-through blocks")
  void shouldPassThroughNullBlocks_whenInputHasNulls() {
    SegmentedDocument document =
        segmenter.segment(Arrays.asList(null, SourceBlock.of(PARAGRAPH)));

    assertThat(document.blocks().get(0).text()).isEmpty();
    assertThat(document.blocks().get(0).isEligible()).isFalse();
    assertThat(document.blocks().get(1).key()).isEqualTo("BLOCK_001");
  }

  @Test
  @DisplayName("should honor the configured minimum length")
  void shouldUseConfiguredMinimum_whenChanged() {
    EnrichmentConfig config = new EnrichmentConfig();
    config.getSegmentation().setMinBlockChars(5);
    BlockSegmenter lenient = new BlockSegmenter(config);

    SegmentedDocument document = lenient.segment(List.of(SourceBlock.of("# Release notes")));

    assertThat(document.eligibleCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should ignore markup punctuation when measuring text")
  void shouldStripMarkup_whenMeasuringLength() {
    assertThat(BlockSegmenter.realTextLength("## **Heading**")).isEqualTo(7);
    assertThat(BlockSegmenter.realTextLength("- [link](http)")).isEqualTo(8);
    assertThat(BlockSegmenter.realTextLength(null)).isZero();
  }

  @Test
  void shouldPadKeysToThreeDigits() {
    assertThat(BlockSegmenter.formatKey(1)).isEqualTo("BLOCK_001");
    assertThat(BlockSegmenter.formatKey(42)).isEqualTo("BLOCK_042");
    assertThat(BlockSegmenter.formatKey(1234)).isEqualTo("BLOCK_1234");
  }
}
