package com.flamingo.ai.chunkgate.completion;

import java.util.stream.Stream;

/**
 * Language-model text completion capability. Implementations either call a real model or return
 * canned text for tests.
 */
public interface TextCompletionService {

  /**
   * Generates a completion for the prompt.
   *
   * @param prompt the user prompt
   * @param options completion settings, null for defaults
   * @param cancellation caller cancellation signal, may be null
   * @return the generated text
   */
  String complete(String prompt, CompletionOptions options, CancellationSignal cancellation);

  /**
   * Streams a completion fragment by fragment. The returned stream is lazy, finite and can be
   * consumed only once.
   *
   * @param prompt the user prompt
   * @param options completion settings, null for defaults
   * @param cancellation caller cancellation signal, may be null
   * @return generated text fragments in order
   */
  Stream<String> completeStreaming(
      String prompt, CompletionOptions options, CancellationSignal cancellation);
}
