package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;
import com.flamingo.ai.site2rag.service.enrichment.model.ValidationOutcome;
import com.flamingo.ai.site2rag.service.enrichment.model.ValidationResult;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks that an enhancement only added {@code [[...]]} annotations.
 *
 * <p>Comparison rules:
 *
 * <ol>
 *   <li>Every {@code [[...]]} span the enhancement added is removed together with the whitespace
 *       before it. Spans already in the original are kept and compared like any other word.
 *   <li>A {@code [[} or {@code ]]} left over after removal makes the enhancement invalid unless the
 *       original carries one too.
 *   <li>Both texts are NFC-normalized and typographic quotes are mapped to ASCII.
 *   <li>Both texts are split on Unicode whitespace; the token sequences must be identical.
 * </ol>
 *
 * <p>An annotation glued between two words ({@code ACME[[x]]Corp}) joins them into one token and
 * is rejected. An annotation before punctuation ({@code company [[ACME]], grew}) is accepted since
 * the tokens of the original are unchanged.
 */
@Component
@Slf4j
public class EnhancementValidator {

  private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
  private static final Pattern SINGLE_QUOTES = Pattern.compile("[‘’‚‛′`]");
  private static final Pattern DOUBLE_QUOTES = Pattern.compile("[“”„‟″]");

  private final Map<String, ValidationResult> cache = new ConcurrentHashMap<>();
  private final int cacheSize;

  public EnhancementValidator(EnrichmentConfig enrichmentConfig) {
    this.cacheSize = enrichmentConfig.getValidation().getCacheSize();
  }

  /**
   * Validates one enhanced block. Results are memoized by a hash of both texts, so retries of an
   * identical pair are not recomputed.
   */
  public ValidationResult validate(String original, String enhanced) {
    if (original == null || enhanced == null) {
      return check(original, enhanced);
    }
    String key = cacheKey(original, enhanced);
    ValidationResult cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    ValidationResult result = check(original, enhanced);
    if (cache.size() >= cacheSize) {
      cache.clear();
    }
    cache.put(key, result);
    return result;
  }

  /**
   * Validates every block of a batch against the provider response. Missing keys and failed checks
   * both count as failures.
   */
  public ValidationOutcome validateBatch(Batch batch, BatchEnhancementResponse response) {
    Map<String, String> validated = new LinkedHashMap<>();
    List<String> failed = new ArrayList<>();

    batch
        .blocks()
        .forEach(
            (key, original) -> {
              String enhanced = response.enhancedBlocks().get(key);
              if (enhanced == null) {
                log.debug("Block {}: missing in response", key);
                failed.add(key);
                return;
              }
              ValidationResult result = validate(original, enhanced);
              if (result.valid()) {
                validated.put(key, enhanced);
              } else {
                log.debug("Block {}: validation failed - {}", key, result.reason());
                failed.add(key);
              }
            });

    return new ValidationOutcome(validated, failed);
  }

  /** Pure word-preservation check. */
  static ValidationResult check(String original, String enhanced) {
    if (original == null) {
      return ValidationResult.invalid("missing original text");
    }
    if (enhanced == null || enhanced.isBlank()) {
      return ValidationResult.invalid("empty enhancement");
    }

    String stripped = Annotations.strip(enhanced);
    String strippedOriginal = Annotations.strip(original);
    if (hasMarkers(stripped) && !hasMarkers(strippedOriginal)) {
      return ValidationResult.invalid("unbalanced annotation markers");
    }

    List<String> expected = tokens(original);
    List<String> actual = tokens(Annotations.stripAdded(original, enhanced));
    int shared = Math.min(expected.size(), actual.size());
    for (int i = 0; i < shared; i++) {
      if (!expected.get(i).equals(actual.get(i))) {
        return ValidationResult.invalid(
            String.format(
                "word %d changed: expected '%s' but found '%s'",
                i + 1, expected.get(i), actual.get(i)));
      }
    }
    if (expected.size() != actual.size()) {
      return ValidationResult.invalid(
          String.format("expected %d words but found %d", expected.size(), actual.size()));
    }
    return ValidationResult.ok();
  }

  private static boolean hasMarkers(String text) {
    return text.contains("[[") || text.contains("]]");
  }

  static List<String> tokens(String text) {
    String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
    normalized = SINGLE_QUOTES.matcher(normalized).replaceAll("'");
    normalized = DOUBLE_QUOTES.matcher(normalized).replaceAll("\"");
    return WHITESPACE.splitAsStream(normalized).filter(token -> !token.isEmpty()).toList();
  }

  private static String cacheKey(String original, String enhanced) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(original.getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 0);
      digest.update(enhanced.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
