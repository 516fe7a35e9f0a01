package com.flamingo.ai.site2rag.exception;

/** Exception thrown when a provider response is not the expected enhanced-blocks JSON object. */
public class InvalidResponseShapeException extends RuntimeException {

  public InvalidResponseShapeException(String message) {
    super(message);
  }

  public InvalidResponseShapeException(String message, Throwable cause) {
    super(message, cause);
  }
}
