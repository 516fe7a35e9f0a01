package com.flamingo.ai.site2rag.config;

import com.flamingo.ai.site2rag.agent.ContextDisambiguationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /**
   * Context disambiguation agent. The system message carries the session's cached context, the
   * user message carries one batch of keyed blocks.
   */
  @Bean
  public ContextDisambiguationAgent contextDisambiguationAgent(ChatModel enrichmentChatModel) {
    return AiServices.builder(ContextDisambiguationAgent.class)
        .chatModel(enrichmentChatModel)
        .build();
  }
}
