package com.flamingo.ai.site2rag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for adding [[...]] context disambiguations to keyed document blocks.
 *
 * <p>The system message is the session's cached context (instructions, document metadata and the
 * active window text). It is identical for every batch of a window, which lets providers with
 * prompt caching reuse it. The user message carries only the blocks of one batch.
 *
 * <p>Returns the raw JSON text; shape checking happens in the provider so that malformed output can
 * be classified and retried.
 */
public interface ContextDisambiguationAgent {

  @SystemMessage("{{cachedContext}}")
  @UserMessage("{{batchPrompt}}")
  String enhance(
      @V("cachedContext") String cachedContext, @V("batchPrompt") String batchPrompt);
}
