package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.Window;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits the eligible block stream into overlapping windows sized to the model's usable context.
 *
 * <p>Window boundaries always fall between blocks. Boundaries depend only on the block word counts,
 * the capacity and the overlap fraction, so planning the same document twice yields the same
 * windows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WindowPlanner {

  private final EnrichmentConfig enrichmentConfig;

  /**
   * Computes the window capacity in words for a model.
   *
   * <p>{@code (contextTokens * utilization - reservedTokens) * wordsPerToken}, clamped to the
   * configured minimum and maximum window size.
   *
   * @param modelName configured model name, may be {@code null}
   * @return capacity in words
   */
  public int calculateCapacity(String modelName) {
    EnrichmentConfig.Window config = enrichmentConfig.getWindow();
    int contextTokens = resolveContextTokens(modelName);

    double usableTokens =
        contextTokens * config.getContextUtilization() - config.getReservedTokens();
    int words = (int) Math.floor(Math.max(0, usableTokens) * config.getWordsPerToken());
    int bounded =
        Math.max(config.getMinWindowWords(), Math.min(config.getMaxWindowWords(), words));

    log.debug(
        "Window sizing - model: {}, context: {} tokens, optimal: {} words, bounded: {} words",
        modelName,
        contextTokens,
        words,
        bounded);
    return bounded;
  }

  /** Context size of the model: the longest configured fragment contained in its name wins. */
  int resolveContextTokens(String modelName) {
    EnrichmentConfig.Window config = enrichmentConfig.getWindow();
    if (modelName == null || modelName.isBlank()) {
      return config.getDefaultContextTokens();
    }
    String model = modelName.toLowerCase();
    return config.getModelContextTokens().entrySet().stream()
        .filter(entry -> model.contains(entry.getKey().toLowerCase()))
        .max((a, b) -> Integer.compare(a.getKey().length(), b.getKey().length()))
        .map(Map.Entry::getValue)
        .orElse(config.getDefaultContextTokens());
  }

  /** Plans windows with the configured overlap fraction. */
  public List<Window> planWindows(List<ContentBlock> blocks, int capacity) {
    return planWindows(blocks, capacity, enrichmentConfig.getWindow().getOverlapFraction());
  }

  /**
   * Plans windows over the given blocks.
   *
   * <p>A window takes blocks until the next one would overflow the capacity (a block larger than
   * the capacity gets a window of its own). The next window starts at the earliest trailing block
   * of the previous window such that the trailing run holds at most {@code overlapFraction *
   * capacity} words, and always at least one block after the previous start.
   *
   * @param blocks eligible blocks in document order
   * @param capacity window capacity in words
   * @param overlapFraction share of the capacity repeated in the next window, in [0, 1)
   * @return windows in document order; empty when there are no blocks
   */
  public List<Window> planWindows(List<ContentBlock> blocks, int capacity, double overlapFraction) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
    }
    if (overlapFraction < 0 || overlapFraction >= 1) {
      throw new IllegalArgumentException("Overlap fraction must be in [0, 1): " + overlapFraction);
    }
    if (blocks.isEmpty()) {
      return List.of();
    }

    int totalWords = blocks.stream().mapToInt(ContentBlock::wordCount).sum();
    if (totalWords <= capacity) {
      log.debug("Document fits one window: {} words, capacity {}", totalWords, capacity);
      return List.of(new Window(0, blocks, totalWords));
    }

    int overlapWords = (int) Math.floor(overlapFraction * capacity);
    List<Window> windows = new ArrayList<>();
    int start = 0;
    while (true) {
      int end = start;
      int words = 0;
      while (end < blocks.size()) {
        int next = blocks.get(end).wordCount();
        if (end > start && words + next > capacity) {
          break;
        }
        words += next;
        end++;
      }
      windows.add(new Window(windows.size(), blocks.subList(start, end), words));

      if (end >= blocks.size()) {
        break;
      }

      int nextStart = end;
      int overlap = 0;
      while (nextStart - 1 > start
          && overlap + blocks.get(nextStart - 1).wordCount() <= overlapWords) {
        overlap += blocks.get(nextStart - 1).wordCount();
        nextStart--;
      }
      start = nextStart;
    }

    log.debug(
        "Planned {} windows over {} words (capacity {}, overlap {} words)",
        windows.size(),
        totalWords,
        capacity,
        overlapWords);
    return windows;
  }
}
