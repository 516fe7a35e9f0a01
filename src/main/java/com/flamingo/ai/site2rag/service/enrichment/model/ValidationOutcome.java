package com.flamingo.ai.site2rag.service.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating one batch response.
 *
 * @param validated enhanced text of every block that passed validation
 * @param failedKeys keys that were missing from the response or failed validation, in batch order
 */
public record ValidationOutcome(Map<String, String> validated, List<String> failedKeys) {

  public ValidationOutcome {
    validated = Collections.unmodifiableMap(new LinkedHashMap<>(validated));
    failedKeys = List.copyOf(failedKeys);
  }

  public boolean allValid() {
    return failedKeys.isEmpty();
  }
}
