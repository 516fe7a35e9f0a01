package com.flamingo.ai.site2rag.service.enrichment.model;

/**
 * Outcome of checking one enhanced block against its original: either valid, or invalid with a
 * reason.
 */
public record ValidationResult(boolean valid, String reason) {

  private static final ValidationResult VALID = new ValidationResult(true, null);

  public static ValidationResult ok() {
    return VALID;
  }

  public static ValidationResult invalid(String reason) {
    return new ValidationResult(false, reason);
  }
}
