package com.flamingo.ai.site2rag.exception;

/**
 * Exception thrown when an enrichment call fails at the transport level: timeout, connection error,
 * rate limit or provider error. Always retryable.
 */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, isRateLimit(cause));
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  private static boolean isRateLimit(Throwable cause) {
    if (cause == null || cause.getMessage() == null) {
      return false;
    }
    String message = cause.getMessage().toLowerCase();
    return message.contains("429") || message.contains("rate limit");
  }
}
