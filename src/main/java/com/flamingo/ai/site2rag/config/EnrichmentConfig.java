package com.flamingo.ai.site2rag.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the context enrichment pipeline. */
@Configuration
@ConfigurationProperties(prefix = "enrichment")
@Getter
@Setter
public class EnrichmentConfig {

  private Segmentation segmentation = new Segmentation();
  private Window window = new Window();
  private Batching batching = new Batching();
  private Session session = new Session();
  private Retry retry = new Retry();
  private Validation validation = new Validation();
  private Provider provider = new Provider();

  @Getter
  @Setter
  public static class Segmentation {
    /** Minimum characters of real text (markup punctuation stripped) for a block to be keyed. */
    private int minBlockChars = 30;
  }

  @Getter
  @Setter
  public static class Window {
    private int minWindowWords = 1000;
    private int maxWindowWords = 5000;

    /** Fraction of the window capacity shared with the next window. */
    private double overlapFraction = 0.5;

    /** Share of the model context the window may occupy. */
    private double contextUtilization = 0.8;

    /** Tokens held back for instructions, metadata and the response. */
    private int reservedTokens = 1500;

    private double wordsPerToken = 0.75;

    /** Context size used when no entry of {@link #modelContextTokens} matches the model name. */
    private int defaultContextTokens = 8192;

    /**
     * Context sizes in tokens keyed by a model-name fragment. The longest fragment contained in the
     * configured model name wins.
     */
    private Map<String, Integer> modelContextTokens = defaultModelContextTokens();

    private static Map<String, Integer> defaultModelContextTokens() {
      Map<String, Integer> limits = new LinkedHashMap<>();
      limits.put("gpt-4o", 128_000);
      limits.put("gpt-4-turbo", 128_000);
      limits.put("gpt-4", 8_192);
      limits.put("gpt-3.5-turbo", 16_000);
      limits.put("claude-3", 200_000);
      limits.put("llama3.2", 128_000);
      limits.put("qwen2.5", 32_768);
      limits.put("mistral-large", 32_768);
      return limits;
    }
  }

  @Getter
  @Setter
  public static class Batching {
    private int targetBatchWords = 500;

    /** Delay added per batch index before a batch starts. */
    private long staggerStepMs = 50;

    /** Upper bound of the per-batch start delay. */
    private long staggerCapMs = 400;
  }

  @Getter
  @Setter
  public static class Session {
    /** Simultaneous in-flight provider calls per session. */
    private int concurrencyLimit = 10;

    /** Sessions unused for longer than this are evicted by the registry sweep. */
    private Duration idleTimeout = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxRetries = 3;

    /** Backoff before retry n is {@code backoffMs * n}. */
    private long backoffMs = 1000;
  }

  @Getter
  @Setter
  public static class Validation {
    /** Maximum number of memoized validation results. */
    private int cacheSize = 10_000;
  }

  /** AI provider selection. */
  @Getter
  @Setter
  public static class Provider {
    /** "openai" (default) or "ollama" (OpenAI-compatible endpoint under {@code host}/v1). */
    private String type = "openai";

    private String model = "gpt-4o-mini";
    private String host = "http://localhost:11434";
    private String apiKey = "";
    private int maxCompletionTokens = 4096;
    private long timeoutMs = 30_000;
  }
}
