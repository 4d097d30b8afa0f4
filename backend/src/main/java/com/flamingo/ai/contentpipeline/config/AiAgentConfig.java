package com.flamingo.ai.contentpipeline.config;

import com.flamingo.ai.contentpipeline.agent.ContentOptimizerAgent;
import com.flamingo.ai.contentpipeline.agent.DraftWriterAgent;
import com.flamingo.ai.contentpipeline.agent.OutlineAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the writing agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Plans the post as markdown headings with source citations. */
  @Bean
  public OutlineAgent outlineAgent(ChatModel chatModel) {
    return AiServices.builder(OutlineAgent.class).chatModel(chatModel).build();
  }

  /** Writes first drafts and revises them against critique feedback. */
  @Bean
  public DraftWriterAgent draftWriterAgent(ChatModel chatModel) {
    return AiServices.builder(DraftWriterAgent.class).chatModel(chatModel).build();
  }

  /** Polishes an approved draft for readability before publishing. */
  @Bean
  public ContentOptimizerAgent contentOptimizerAgent(ChatModel chatModel) {
    return AiServices.builder(ContentOptimizerAgent.class).chatModel(chatModel).build();
  }
}
