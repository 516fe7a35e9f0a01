package com.flamingo.ai.site2rag.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.site2rag.service.enrichment.model.BlockStatus;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.EnhancedBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.SegmentedDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Reassembler Tests")
class ReassemblerTest {

  private final Reassembler reassembler = new Reassembler();

  @Test
  @DisplayName("should return one block per input in order with statuses")
  void shouldPreserveOrderAndCount_whenReassembling() {
    Map<String, String> keyed = new LinkedHashMap<>();
    keyed.put("BLOCK_001", "He left early.");
    keyed.put("BLOCK_002", "It rained all day.");
    keyed.put("BLOCK_003", "They met again later.");
    SegmentedDocument document =
        new SegmentedDocument(
            List.of(
                new ContentBlock(null, "# Title", 0, 2),
                new ContentBlock("BLOCK_001", "He left early.", 1, 3),
                new ContentBlock("BLOCK_002", "It rained all day.", 2, 4),
                new ContentBlock(null, "---", 3, 1),
                new ContentBlock("BLOCK_003", "They met again later.", 4, 4)),
            keyed);

    List<EnhancedBlock> output =
        reassembler.reassemble(
            document,
            Map.of("BLOCK_001", "He [[Tom]] left early.", "BLOCK_002", "It rained all day."),
            Set.of("BLOCK_002"));

    assertThat(output).hasSize(5);
    assertThat(output)
        .extracting(EnhancedBlock::status)
        .containsExactly(
            BlockStatus.PASS_THROUGH,
            BlockStatus.ENHANCED,
            BlockStatus.FALLBACK,
            BlockStatus.PASS_THROUGH,
            BlockStatus.FALLBACK);
    assertThat(output)
        .extracting(EnhancedBlock::original)
        .containsExactly(
            "# Title", "He left early.", "It rained all day.", "---", "They met again later.");
    assertThat(output.get(1).enhanced()).isEqualTo("He [[Tom]] left early.");
    assertThat(output.get(4).enhanced()).isEqualTo("They met again later.");
  }

  @Test
  @DisplayName("should mark validated text without added annotations as unchanged")
  void shouldMarkUnchanged_whenNothingAdded() {
    SegmentedDocument document =
        new SegmentedDocument(
            List.of(
                new ContentBlock("BLOCK_001", "See the [[Main Page]] article.", 0, 5),
                new ContentBlock("BLOCK_002", "See the [[Main Page]] article.", 1, 5)),
            Map.of(
                "BLOCK_001", "See the [[Main Page]] article.",
                "BLOCK_002", "See the [[Main Page]] article."));

    List<EnhancedBlock> output =
        reassembler.reassemble(
            document,
            Map.of(
                "BLOCK_001", "See the [[Main Page]] article.",
                "BLOCK_002", "See the [[Main Page]] article [[wiki]]."),
            Set.of());

    assertThat(output)
        .extracting(EnhancedBlock::status)
        .containsExactly(BlockStatus.UNCHANGED, BlockStatus.ENHANCED);
  }
}
