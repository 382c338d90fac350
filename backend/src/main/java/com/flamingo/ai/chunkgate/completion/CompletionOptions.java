package com.flamingo.ai.chunkgate.completion;

/**
 * Per-request completion settings. Null fields fall back to the model defaults.
 *
 * @param systemPrompt optional system (role) instruction
 * @param temperature sampling temperature, 0.0 to 2.0
 * @param maxTokens maximum number of generated tokens
 * @param jsonMode whether the model must answer with a JSON object
 */
public record CompletionOptions(
    String systemPrompt, Double temperature, Integer maxTokens, boolean jsonMode) {

  private static final CompletionOptions DEFAULTS = new CompletionOptions(null, null, null, false);

  public static CompletionOptions defaults() {
    return DEFAULTS;
  }
}
