package com.flamingo.ai.site2rag.api.dto.request;

import com.flamingo.ai.site2rag.service.enrichment.model.DocumentMetadata;
import com.flamingo.ai.site2rag.service.enrichment.model.SourceBlock;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for enriching one document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichDocumentRequest {

  @Size(max = 500, message = "Title must be at most 500 characters")
  private String title;

  private String url;
  private String description;

  @NotNull(message = "Blocks are required")
  @Valid
  private List<BlockRequest> blocks;

  public DocumentMetadata toMetadata() {
    return new DocumentMetadata(title, url, description);
  }

  public List<SourceBlock> toSourceBlocks() {
    return blocks.stream().map(block -> new SourceBlock(block.getText(), block.getType())).toList();
  }
}
