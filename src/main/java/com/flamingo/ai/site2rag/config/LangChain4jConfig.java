package com.flamingo.ai.site2rag.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j chat model used by the enrichment agent. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  static final String OLLAMA = "ollama";
  static final String OPENAI = "openai";

  private final EnrichmentConfig enrichmentConfig;

  @Bean
  public ChatModel enrichmentChatModel() {
    EnrichmentConfig.Provider provider = enrichmentConfig.getProvider();
    String type = provider.getType() == null ? OPENAI : provider.getType().toLowerCase();

    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .modelName(provider.getModel())
            .maxCompletionTokens(provider.getMaxCompletionTokens())
            .timeout(Duration.ofMillis(provider.getTimeoutMs()))
            .responseFormat("json_object")
            .logRequests(false)
            .logResponses(false);

    switch (type) {
      case OLLAMA -> builder.baseUrl(stripTrailingSlash(provider.getHost()) + "/v1").apiKey(OLLAMA);
      case OPENAI -> builder.apiKey(requireApiKey(provider.getApiKey()));
      default -> throw new IllegalStateException("Unsupported enrichment provider: " + type);
    }

    log.info(
        "Enrichment chat model initialized: provider={}, model={}, timeout={}ms",
        type,
        provider.getModel(),
        provider.getTimeoutMs());
    return builder.build();
  }

  private static String requireApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    return apiKey;
  }

  private static String stripTrailingSlash(String host) {
    return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
  }
}
