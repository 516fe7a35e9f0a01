package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.BlockStatus;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.EnhancedBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.SegmentedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Maps final keyed texts back onto the input stream, preserving order and count. */
@Component
public class Reassembler {

  /**
   * Builds one output pair per input block.
   *
   * @param document segmented input
   * @param finalTexts key to final text; keys missing here keep their original text
   * @param fallbackKeys keys that fell back to their original text
   * @return output blocks in input order
   */
  public List<EnhancedBlock> reassemble(
      SegmentedDocument document, Map<String, String> finalTexts, Set<String> fallbackKeys) {
    List<EnhancedBlock> output = new ArrayList<>(document.blocks().size());
    for (ContentBlock block : document.blocks()) {
      if (!block.isEligible()) {
        output.add(new EnhancedBlock(block.text(), block.text(), BlockStatus.PASS_THROUGH));
        continue;
      }
      String text = finalTexts.get(block.key());
      if (text == null || fallbackKeys.contains(block.key())) {
        output.add(new EnhancedBlock(block.text(), block.text(), BlockStatus.FALLBACK));
      } else if (Annotations.countAdded(block.text(), text) == 0) {
        output.add(new EnhancedBlock(block.text(), text, BlockStatus.UNCHANGED));
      } else {
        output.add(new EnhancedBlock(block.text(), text, BlockStatus.ENHANCED));
      }
    }
    return output;
  }
}
