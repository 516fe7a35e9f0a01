package com.flamingo.ai.site2rag.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.DocumentMetadata;
import com.flamingo.ai.site2rag.service.enrichment.model.Window;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EnrichmentPrompts Tests")
class EnrichmentPromptsTest {

  @Test
  @DisplayName("should embed document metadata with fallbacks")
  void shouldIncludeMetadata_whenBuildingInstructions() {
    String instructions =
        EnrichmentPrompts.instructions(
            new DocumentMetadata("Apollo Guide", "https://example.com/apollo", null));

    assertThat(instructions)
        .contains("Title: Apollo Guide")
        .contains("URL: https://example.com/apollo")
        .contains("Description: None")
        .contains("[[...]]");
    assertThat(EnrichmentPrompts.instructions(null)).contains("Title: Unknown");
  }

  @Test
  @DisplayName("should use finalized text for blocks carried over from a previous window")
  void shouldUseFinalizedText_whenBuildingWindowText() {
    Window window =
        new Window(
            1,
            List.of(
                new ContentBlock("BLOCK_001", "He left.", 0, 2),
                new ContentBlock("BLOCK_002", "She stayed.", 1, 2)),
            4);

    String text = EnrichmentPrompts.windowText(window, Map.of("BLOCK_001", "He [[John]] left."));

    assertThat(text).isEqualTo("He [[John]] left.\n\nShe stayed.");
    assertThat(EnrichmentPrompts.cachedContext("RULES", 1, text))
        .isEqualTo("RULES\n\n## Document Context Window 2\n" + text);
  }

  @Test
  @DisplayName("should list only the batch's keyed blocks in the batch prompt")
  void shouldListKeyedBlocks_whenBuildingBatchPrompt() {
    Map<String, String> blocks = new LinkedHashMap<>();
    blocks.put("BLOCK_003", "First block.");
    blocks.put("BLOCK_004", "Second block.");

    String prompt = EnrichmentPrompts.batchPrompt(Batch.of(blocks));

    assertThat(prompt)
        .contains("BLOCK_003:\nFirst block.\n\nBLOCK_004:\nSecond block.")
        .contains("\"enhanced_blocks\"")
        .contains("\"BLOCK_003\": \"...\", \"BLOCK_004\": \"...\"");
  }
}
