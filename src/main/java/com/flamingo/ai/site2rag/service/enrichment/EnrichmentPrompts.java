package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.DocumentMetadata;
import com.flamingo.ai.site2rag.service.enrichment.model.Window;
import java.util.Map;
import java.util.stream.Collectors;

/** Prompt text for the context disambiguation session. */
public final class EnrichmentPrompts {

  public static final String RESPONSE_FIELD = "enhanced_blocks";

  private EnrichmentPrompts() {
    // utility class
  }

  /** Static instructions and document metadata, set once per session. */
  public static String instructions(DocumentMetadata metadata) {
    DocumentMetadata meta = metadata == null ? DocumentMetadata.empty() : metadata;
    return """
        # CONTEXT DISAMBIGUATION SESSION

        ## Document Metadata
        Title: %s
        URL: %s
        Description: %s

        ## Instructions
        You receive keyed blocks of markdown from the document above together with a window of
        surrounding document text. Make each block understandable on its own by inserting short
        clarifications in [[...]] right after ambiguous references.

        - Clarify pronouns: "he" -> "he [[John Smith]]"
        - Clarify vague references such as "this", "that", "the project"
        - Expand acronyms using full forms found in the document
        - Add time, place or role context only when the document states it
        - Only use information found in the document context window
        - Do not repeat what the sentence already makes clear

        ## Preservation Rules
        - Keep every original word, in the same order, with the same punctuation
        - Never remove, reword or reorder original text
        - Never change markdown syntax, URLs, link text or image alt text
        - Never put [[...]] inside URLs or markdown syntax
        - Leave a block unchanged when nothing needs clarification
        """
        .formatted(
            valueOr(meta.title(), "Unknown"),
            valueOr(meta.url(), "Unknown"),
            valueOr(meta.description(), "None"));
  }

  /** Cached context for one window: instructions followed by the window text. */
  public static String cachedContext(String instructions, int windowIndex, String windowText) {
    return instructions + "\n\n## Document Context Window " + (windowIndex + 1) + "\n" + windowText;
  }

  /**
   * Window text, using the already-finalized text of blocks carried over from the previous window.
   */
  public static String windowText(Window window, Map<String, String> finalizedTexts) {
    return window.blocks().stream()
        .map(block -> finalizedTexts.getOrDefault(block.key(), block.text()))
        .collect(Collectors.joining("\n\n"));
  }

  /** User prompt for one batch: only the batch's keyed blocks. */
  public static String batchPrompt(Batch batch) {
    String blocks =
        batch.blocks().entrySet().stream()
            .map(entry -> entry.getKey() + ":\n" + entry.getValue())
            .collect(Collectors.joining("\n\n"));
    String keys =
        batch.keys().stream()
            .map(key -> "\"" + key + "\": \"...\"")
            .collect(Collectors.joining(", "));
    return """
        Add context to these blocks where needed:

        %s

        Return ONLY a JSON object of the form {"%s": {%s}} containing every key above.
        """
        .formatted(blocks, RESPONSE_FIELD, keys);
  }

  private static String valueOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
