package com.flamingo.ai.site2rag.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One content block of a document to enrich. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockRequest {

  @NotNull(message = "Block text is required")
  private String text;

  /** Optional block type hint such as "paragraph" or "heading". */
  private String type;
}
