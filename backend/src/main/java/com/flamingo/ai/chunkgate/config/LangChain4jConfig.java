package com.flamingo.ai.chunkgate.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j models behind the completion provider. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:256}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:30}")
  private int timeoutSeconds;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public StreamingChatModel streamingChatModel() {
    validateApiKey();

    return OpenAiStreamingChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds * 4L))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
