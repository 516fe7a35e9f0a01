package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.ProgressListener;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/** Progress of one document run, reported to the caller after every completed batch. */
@Slf4j
public class ProgressTracker {

  private final ProgressListener listener;
  private final int total;
  private final Set<String> processed = new HashSet<>();

  public ProgressTracker(ProgressListener listener, int total) {
    this.listener = listener == null ? ProgressListener.NO_OP : listener;
    this.total = total;
  }

  /** Records finalized keys and notifies the listener. Keys already counted are ignored. */
  public synchronized void completed(Collection<String> keys) {
    processed.addAll(keys);
    try {
      listener.onProgress(processed.size(), total);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed: {}", e.getMessage());
    }
  }

  public synchronized int processed() {
    return processed.size();
  }

  public int total() {
    return total;
  }
}
