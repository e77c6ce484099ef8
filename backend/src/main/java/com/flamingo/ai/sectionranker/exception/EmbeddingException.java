package com.flamingo.ai.sectionranker.exception;

/**
 * Exception thrown when the embedding provider cannot produce a vector for a text.
 *
 * <p>Blank input is never retryable; model-side failures are.
 */
public class EmbeddingException extends RuntimeException {

  private final boolean retryable;
  private final String userMessage;

  public EmbeddingException(String message) {
    super(message);
    this.retryable = false;
    this.userMessage = "Embedding is temporarily unavailable. Please try again.";
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
    this.retryable = true;
    this.userMessage = "Embedding is temporarily unavailable. Please try again.";
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
