package com.flamingo.ai.site2rag.exception;

/** Exception thrown when an enrichment session is not registered. */
public class SessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
