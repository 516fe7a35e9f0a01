package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.BatchEnhancementResponse;
import com.flamingo.ai.site2rag.service.enrichment.provider.EnrichmentProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic provider for pipeline tests. Reads the keyed blocks out of the batch prompt and
 * answers with an annotation after the first word of each block.
 */
class FakeEnrichmentProvider implements EnrichmentProvider {

  private static final Pattern KEYED_BLOCK =
      Pattern.compile(
          "(BLOCK_\\d+):\\n(.*?)(?=\\n\\nBLOCK_\\d+:\\n|\\n\\nReturn ONLY)", Pattern.DOTALL);

  private final Set<String> omittedKeys = ConcurrentHashMap.newKeySet();
  private final Set<String> rewrittenKeys = ConcurrentHashMap.newKeySet();
  private final Set<String> keptKeys = ConcurrentHashMap.newKeySet();
  private final Deque<RuntimeException> failures = new ConcurrentLinkedDeque<>();
  private final List<List<String>> requestedKeys = new CopyOnWriteArrayList<>();
  private final List<String> contexts = new CopyOnWriteArrayList<>();
  private final AtomicInteger calls = new AtomicInteger();

  /** Leaves the key out of every response. */
  FakeEnrichmentProvider omit(String key) {
    omittedKeys.add(key);
    return this;
  }

  /** Returns the key with a changed word, which never validates. */
  FakeEnrichmentProvider rewrite(String key) {
    rewrittenKeys.add(key);
    return this;
  }

  /** Returns the key exactly as sent, without annotations. */
  FakeEnrichmentProvider keep(String key) {
    keptKeys.add(key);
    return this;
  }

  /** Throws the given failure on the next call. */
  FakeEnrichmentProvider failNext(RuntimeException failure) {
    failures.add(failure);
    return this;
  }

  @Override
  public BatchEnhancementResponse enhance(String cachedContext, String batchPrompt) {
    calls.incrementAndGet();
    contexts.add(cachedContext);
    Map<String, String> blocks = parseBlocks(batchPrompt);
    requestedKeys.add(List.copyOf(blocks.keySet()));

    RuntimeException failure = failures.poll();
    if (failure != null) {
      throw failure;
    }

    Map<String, String> enhanced = new LinkedHashMap<>();
    blocks.forEach(
        (key, text) -> {
          if (omittedKeys.contains(key)) {
            return;
          }
          if (keptKeys.contains(key)) {
            enhanced.put(key, text);
          } else {
            enhanced.put(key, rewrittenKeys.contains(key) ? "changed " + text : annotate(text));
          }
        });
    return new BatchEnhancementResponse(enhanced);
  }

  static String annotate(String text) {
    return text.replaceFirst("^(\\S+)", "$1 [[ctx]]");
  }

  static Map<String, String> parseBlocks(String batchPrompt) {
    Map<String, String> blocks = new LinkedHashMap<>();
    Matcher matcher = KEYED_BLOCK.matcher(batchPrompt);
    while (matcher.find()) {
      blocks.put(matcher.group(1), matcher.group(2));
    }
    return blocks;
  }

  int calls() {
    return calls.get();
  }

  List<List<String>> requestedKeys() {
    return new ArrayList<>(requestedKeys);
  }

  List<String> contexts() {
    return Collections.unmodifiableList(contexts);
  }
}
