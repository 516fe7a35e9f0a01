package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.exception.SessionNotFoundException;
import com.flamingo.ai.site2rag.service.enrichment.model.Batch;
import com.flamingo.ai.site2rag.service.enrichment.model.BlockStatus;
import com.flamingo.ai.site2rag.service.enrichment.model.CacheMetrics;
import com.flamingo.ai.site2rag.service.enrichment.model.CancellationToken;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.DocumentMetadata;
import com.flamingo.ai.site2rag.service.enrichment.model.EnhancedBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentResult;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentSummary;
import com.flamingo.ai.site2rag.service.enrichment.model.PipelineState;
import com.flamingo.ai.site2rag.service.enrichment.model.ProgressListener;
import com.flamingo.ai.site2rag.service.enrichment.model.SegmentedDocument;
import com.flamingo.ai.site2rag.service.enrichment.model.SourceBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.Window;
import com.flamingo.ai.site2rag.service.enrichment.model.WindowResult;
import com.flamingo.ai.site2rag.service.session.EnrichmentSession;
import com.flamingo.ai.site2rag.service.session.EnrichmentSessionRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Window-by-window enrichment of a document through one session.
 *
 * <p>A block is sent to the model only in the first window containing it. Later windows see its
 * finalized text as part of their context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextEnrichmentServiceImpl implements ContextEnrichmentService {

  private static final String NO_SESSION = "(none)";

  private final BlockSegmenter blockSegmenter;
  private final WindowPlanner windowPlanner;
  private final BatchBuilder batchBuilder;
  private final BatchExecutor batchExecutor;
  private final Reassembler reassembler;
  private final EnrichmentSessionRegistry sessionRegistry;
  private final EnrichmentConfig enrichmentConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "enrichment.document", description = "Time to enrich one document")
  public EnrichmentResult enrich(List<SourceBlock> blocks, DocumentMetadata metadata) {
    return enrich(blocks, metadata, ProgressListener.NO_OP, CancellationToken.none());
  }

  @Override
  @Timed(value = "enrichment.document", description = "Time to enrich one document")
  public EnrichmentResult enrich(
      List<SourceBlock> blocks,
      DocumentMetadata metadata,
      ProgressListener progressListener,
      CancellationToken cancellationToken) {
    long startedAt = System.currentTimeMillis();
    CancellationToken token =
        cancellationToken == null ? CancellationToken.none() : cancellationToken;
    transition(NO_SESSION, PipelineState.INIT);

    SegmentedDocument document = blockSegmenter.segment(blocks == null ? List.of() : blocks);
    transition(NO_SESSION, PipelineState.SEGMENTED);
    log.info(
        "Segmented {} blocks: {} eligible, {} pass-through",
        document.blocks().size(),
        document.eligibleCount(),
        document.passThroughCount());

    if (document.eligibleCount() == 0) {
      List<EnhancedBlock> output = reassembler.reassemble(document, Map.of(), Set.of());
      transition(NO_SESSION, PipelineState.DONE);
      return finish(output, 0, 0, CacheMetrics.empty(), startedAt, false);
    }

    int capacity = windowPlanner.calculateCapacity(enrichmentConfig.getProvider().getModel());
    List<Window> windows = windowPlanner.planWindows(document.eligibleBlocks(), capacity);
    transition(NO_SESSION, PipelineState.WINDOWS_PLANNED);
    log.info(
        "Planned {} windows of up to {} words for {} eligible words",
        windows.size(),
        capacity,
        document.eligibleWordCount());

    EnrichmentSession session;
    try {
      session = sessionRegistry.create(EnrichmentPrompts.instructions(metadata));
    } catch (RuntimeException e) {
      transition(NO_SESSION, PipelineState.FAILED);
      throw e;
    }
    String sessionId = session.getId();

    ProgressTracker progressTracker =
        new ProgressTracker(progressListener, document.eligibleCount());
    Map<String, String> finalTexts = new LinkedHashMap<>();
    Set<String> fallbackKeys = new HashSet<>();
    int batchCount = 0;

    try {
      for (Window window : windows) {
        if (token.isCancelled()) {
          break;
        }
        List<ContentBlock> pending =
            window.blocks().stream().filter(block -> !finalTexts.containsKey(block.key())).toList();
        if (pending.isEmpty()) {
          continue;
        }

        session.setWindowContext(window.index(), EnrichmentPrompts.windowText(window, finalTexts));
        transition(sessionId, PipelineState.CACHE_SET);

        List<Batch> batches = batchBuilder.buildBatches(pending);
        transition(sessionId, PipelineState.BATCHES_DISPATCHED);
        WindowResult result = batchExecutor.execute(session, batches, token, progressTracker);
        transition(sessionId, PipelineState.VALIDATED);

        finalTexts.putAll(result.texts());
        fallbackKeys.addAll(result.fallbackKeys());
        batchCount += result.batchCount();
        transition(sessionId, PipelineState.MERGED);
        log.info(
            "Session {} - window {}/{}: {} batches, {} blocks, {} fallbacks",
            sessionId,
            window.index() + 1,
            windows.size(),
            result.batchCount(),
            result.texts().size(),
            result.fallbackKeys().size());
      }
    } catch (RuntimeException e) {
      transition(sessionId, PipelineState.FAILED);
      closeQuietly(session);
      throw e;
    }

    CacheMetrics cacheMetrics = closeQuietly(session);
    boolean cancelled = token.isCancelled();
    if (cancelled) {
      transition(sessionId, PipelineState.CANCELLED);
    }

    List<EnhancedBlock> output = reassembler.reassemble(document, finalTexts, fallbackKeys);
    transition(sessionId, PipelineState.REASSEMBLED);
    EnrichmentResult result =
        finish(output, windows.size(), batchCount, cacheMetrics, startedAt, cancelled);
    if (!cancelled) {
      transition(sessionId, PipelineState.DONE);
    }
    return result;
  }

  private EnrichmentResult finish(
      List<EnhancedBlock> output,
      int windowCount,
      int batchCount,
      CacheMetrics cacheMetrics,
      long startedAt,
      boolean cancelled) {
    int enhanced = countStatus(output, BlockStatus.ENHANCED);
    int unchanged = countStatus(output, BlockStatus.UNCHANGED);
    int fallback = countStatus(output, BlockStatus.FALLBACK);
    int passThrough = countStatus(output, BlockStatus.PASS_THROUGH);
    int annotations =
        output.stream()
            .filter(block -> block.status() == BlockStatus.ENHANCED)
            .mapToInt(block -> Annotations.countAdded(block.original(), block.enhanced()))
            .sum();

    EnrichmentSummary summary =
        EnrichmentSummary.builder()
            .totalBlocks(output.size())
            .eligibleBlocks(enhanced + unchanged + fallback)
            .enhancedBlocks(enhanced)
            .unchangedBlocks(unchanged)
            .fallbackBlocks(fallback)
            .passThroughBlocks(passThrough)
            .annotations(annotations)
            .windows(windowCount)
            .batches(batchCount)
            .cacheMetrics(cacheMetrics)
            .durationMs(System.currentTimeMillis() - startedAt)
            .cancelled(cancelled)
            .build();

    meterRegistry.counter("enrichment.blocks.enhanced").increment(enhanced);
    meterRegistry.counter("enrichment.blocks.unchanged").increment(unchanged);
    meterRegistry.counter("enrichment.blocks.fallback").increment(fallback);
    meterRegistry.counter("enrichment.blocks.pass_through").increment(passThrough);
    meterRegistry.counter("enrichment.cache.hits").increment(cacheMetrics.hits());
    meterRegistry.counter("enrichment.cache.misses").increment(cacheMetrics.misses());

    log.info(
        "Enrichment complete: {} blocks ({} enhanced, {} fallback, {} pass-through), "
            + "{} annotations, {} windows, {} batches, cache hit rate {}%, {} ms{}",
        summary.totalBlocks(),
        enhanced,
        fallback,
        passThrough,
        annotations,
        windowCount,
        batchCount,
        String.format("%.1f", cacheMetrics.hitRate()),
        summary.durationMs(),
        cancelled ? " (cancelled)" : "");
    return new EnrichmentResult(output, summary);
  }

  private static int countStatus(List<EnhancedBlock> output, BlockStatus status) {
    return (int) output.stream().filter(block -> block.status() == status).count();
  }

  /** Closes the session; one already evicted by the idle sweep still reports its metrics. */
  private CacheMetrics closeQuietly(EnrichmentSession session) {
    try {
      return sessionRegistry.close(session.getId());
    } catch (SessionNotFoundException e) {
      log.warn("Session {} was already closed: {}", session.getId(), e.getMessage());
      return session.metrics();
    }
  }

  private static void transition(String sessionId, PipelineState state) {
    log.debug("Session {} -> {}", sessionId, state);
  }
}
