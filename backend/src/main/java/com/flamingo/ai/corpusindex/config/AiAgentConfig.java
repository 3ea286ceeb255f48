package com.flamingo.ai.corpusindex.config;

import com.flamingo.ai.corpusindex.agent.ClusterLabelingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are declared as interfaces with @SystemMessage/@UserMessage and materialized with
 * AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Labels taxonomy clusters from a sample of member document titles and abstracts. */
  @Bean
  public ClusterLabelingAgent clusterLabelingAgent(ChatModel chatModel) {
    return AiServices.builder(ClusterLabelingAgent.class).chatModel(chatModel).build();
  }
}
