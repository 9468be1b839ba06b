package com.flamingo.ai.docrag.config;

import com.flamingo.ai.docrag.agent.AnswerAgent;
import com.flamingo.ai.docrag.service.rag.retry.ProviderRetryPolicy;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the answer agent and the retry policy shared by provider calls.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage, concrete implementations are
 * built with AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Grounded answer agent. Uses ChatModel for plain text output. */
  @Bean
  public AnswerAgent answerAgent(ChatModel chatModel) {
    return AiServices.builder(AnswerAgent.class).chatModel(chatModel).build();
  }

  /** Retry policy for embedding and generation calls, configured under {@code rag.retry}. */
  @Bean
  public ProviderRetryPolicy providerRetryPolicy(RagConfig ragConfig, MeterRegistry registry) {
    return ProviderRetryPolicy.fromConfig("provider", ragConfig.getRetry(), registry);
  }
}
