package com.flamingo.ai.site2rag.service.enrichment.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.site2rag.agent.ContextDisambiguationAgent;
import com.flamingo.ai.site2rag.exception.InvalidResponseShapeException;
import com.flamingo.ai.site2rag.exception.LlmServiceException;
import com.flamingo.ai.site2rag.service.enrichment.EnrichmentPrompts;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link EnrichmentProvider} backed by the LangChain4j {@link ContextDisambiguationAgent}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEnrichmentProvider implements EnrichmentProvider {

  private final ContextDisambiguationAgent contextDisambiguationAgent;
  private final ObjectMapper objectMapper;

  @Override
  @CircuitBreaker(name = "llm")
  public BatchEnhancementResponse enhance(String cachedContext, String batchPrompt) {
    String raw;
    try {
      raw = contextDisambiguationAgent.enhance(cachedContext, batchPrompt);
    } catch (RuntimeException e) {
      throw new LlmServiceException("Enrichment call failed: " + e.getMessage(), e);
    }
    return parse(raw);
  }

  /**
   * Parses {@code {"enhanced_blocks": {"KEY": "text", ...}}}. A surrounding markdown code fence is
   * tolerated.
   */
  BatchEnhancementResponse parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidResponseShapeException("Empty response from provider");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(raw.trim()));
    } catch (JsonProcessingException e) {
      throw new InvalidResponseShapeException("Response is not valid JSON", e);
    }

    JsonNode blocks = root == null ? null : root.get(EnrichmentPrompts.RESPONSE_FIELD);
    if (blocks == null || !blocks.isObject()) {
      throw new InvalidResponseShapeException(
          "Response has no '" + EnrichmentPrompts.RESPONSE_FIELD + "' object");
    }

    Map<String, String> enhanced = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = blocks.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isTextual()) {
        throw new InvalidResponseShapeException(
            "Block " + field.getKey() + " is not a string in the response");
      }
      enhanced.put(field.getKey(), field.getValue().asText());
    }
    log.debug("Parsed {} enhanced blocks from provider response", enhanced.size());
    return new BatchEnhancementResponse(enhanced);
  }

  private static String stripCodeFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    int closingFence = text.lastIndexOf("```");
    if (firstNewline < 0 || closingFence <= firstNewline) {
      return text;
    }
    return text.substring(firstNewline + 1, closingFence).trim();
  }
}
