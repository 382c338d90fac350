package com.flamingo.ai.chunkgate.completion;

import com.flamingo.ai.chunkgate.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TextCompletionService} backed by LangChain4j chat models. Provider errors are wrapped in
 * {@link LlmServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jCompletionService implements TextCompletionService {

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;

  @Override
  public String complete(
      String prompt, CompletionOptions options, CancellationSignal cancellation) {
    if (cancellation != null) {
      cancellation.throwIfCancellationRequested();
    }
    ChatRequest request = buildRequest(prompt, options);
    try {
      ChatResponse response = chatModel.chat(request);
      String text = response.aiMessage().text();
      log.debug("Completion returned {} characters", text == null ? 0 : text.length());
      return text == null ? "" : text;
    } catch (RuntimeException e) {
      throw wrap(e);
    }
  }

  @Override
  public Stream<String> completeStreaming(
      String prompt, CompletionOptions options, CancellationSignal cancellation) {
    ChatRequest request = buildRequest(prompt, options);
    StreamingCompletionIterator iterator =
        new StreamingCompletionIterator(
            handler -> {
              try {
                streamingChatModel.chat(request, handler);
              } catch (RuntimeException e) {
                handler.onError(e);
              }
            },
            cancellation == null ? CancellationSignal.none() : cancellation);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  private ChatRequest buildRequest(String prompt, CompletionOptions options) {
    CompletionOptions effective = options == null ? CompletionOptions.defaults() : options;

    List<ChatMessage> messages = new ArrayList<>();
    if (effective.systemPrompt() != null && !effective.systemPrompt().isBlank()) {
      messages.add(SystemMessage.from(effective.systemPrompt()));
    }
    messages.add(UserMessage.from(prompt));

    ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
    if (effective.temperature() != null) {
      builder.temperature(effective.temperature());
    }
    if (effective.maxTokens() != null) {
      builder.maxOutputTokens(effective.maxTokens());
    }
    if (effective.jsonMode()) {
      builder.responseFormat(ResponseFormat.JSON);
    }
    return builder.build();
  }

  private LlmServiceException wrap(RuntimeException e) {
    if (e instanceof LlmServiceException llmServiceException) {
      return llmServiceException;
    }
    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    String lower = message.toLowerCase(Locale.ROOT);
    boolean rateLimited = lower.contains("429") || lower.contains("rate limit");
    return new LlmServiceException("Completion request failed: " + message, e, rateLimited);
  }
}
