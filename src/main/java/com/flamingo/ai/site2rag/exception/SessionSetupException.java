package com.flamingo.ai.site2rag.exception;

/**
 * Exception thrown when an enrichment session cannot be established or cannot take the cached
 * context of a window. Fatal for the document being enriched.
 */
public class SessionSetupException extends RuntimeException {

  private final String sessionId;
  private final String userMessage;

  public SessionSetupException(String sessionId, String message) {
    super(message);
    this.sessionId = sessionId;
    this.userMessage = "Failed to prepare the enrichment session";
  }

  public SessionSetupException(String sessionId, String message, Throwable cause) {
    super(message, cause);
    this.sessionId = sessionId;
    this.userMessage = "Failed to prepare the enrichment session";
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
