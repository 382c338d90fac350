package com.flamingo.ai.chunkgate.exception;

/** Exception thrown when the completion provider fails. */
public class LlmServiceException extends RuntimeException {

  private static final String UNAVAILABLE_MESSAGE =
      "AI service is temporarily unavailable. Please try again later.";

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : UNAVAILABLE_MESSAGE;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
