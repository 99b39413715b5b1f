package com.flamingo.ai.studybuddy.config;

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible streaming model, used as the generation source when {@code
 * engine.source.type=langchain4j}. Works against a local server as well as the hosted API.
 */
@Configuration
@ConditionalOnProperty(name = "engine.source.type", havingValue = "langchain4j")
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:120}")
  private long timeoutSeconds;

  @Bean
  public StreamingChatModel streamingChatModel() {
    validateApiKey();

    OpenAiStreamingChatModel.OpenAiStreamingChatModelBuilder builder =
        OpenAiStreamingChatModel.builder()
            .apiKey(openAiApiKey)
            .modelName(chatModelName)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .logRequests(false)
            .logResponses(false);
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  public String getChatModelName() {
    return chatModelName;
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required when engine.source.type=langchain4j. "
              + "Set OPENAI_API_KEY environment variable.");
    }
  }
}
