package com.flamingo.ai.site2rag.service.session;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.exception.SessionNotFoundException;
import com.flamingo.ai.site2rag.service.enrichment.model.CacheMetrics;
import com.flamingo.ai.site2rag.service.enrichment.provider.EnrichmentProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Registry of open enrichment sessions with explicit create, get and close.
 *
 * <p>Owned by the caller through dependency injection; there is no static session state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrichmentSessionRegistry {

  private final Map<String, EnrichmentSession> sessions = new ConcurrentHashMap<>();

  private final EnrichmentProvider enrichmentProvider;
  private final EnrichmentConfig enrichmentConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Opens a session holding the given static instructions.
   *
   * @param instructions static instructions and document metadata
   * @return the new session
   * @throws com.flamingo.ai.site2rag.exception.SessionSetupException if the instructions are
   *     empty
   */
  public EnrichmentSession create(String instructions) {
    String sessionId = "enrich-" + UUID.randomUUID();
    EnrichmentSession session =
        new EnrichmentSession(
            sessionId,
            instructions,
            enrichmentProvider,
            enrichmentConfig.getSession().getConcurrencyLimit(),
            clock);
    sessions.put(sessionId, session);
    meterRegistry.counter("enrichment.session.created").increment();
    log.debug("Created enrichment session {}", sessionId);
    return session;
  }

  /**
   * Gets an open session.
   *
   * @throws SessionNotFoundException if no session with this ID is registered
   */
  public EnrichmentSession get(String sessionId) {
    EnrichmentSession session = sessions.get(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    return session;
  }

  /**
   * Closes and unregisters a session.
   *
   * @return the session's final cache metrics
   * @throws SessionNotFoundException if no session with this ID is registered
   */
  public CacheMetrics close(String sessionId) {
    EnrichmentSession session = sessions.remove(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    CacheMetrics metrics = session.close();
    meterRegistry.counter("enrichment.session.closed").increment();
    log.debug(
        "Closed enrichment session {}: {} hits, {} misses",
        sessionId,
        metrics.hits(),
        metrics.misses());
    return metrics;
  }

  public int openSessions() {
    return sessions.size();
  }

  /** Closes sessions left unused for longer than the configured idle timeout. */
  @Scheduled(fixedDelayString = "${enrichment.session.sweep-interval-ms:60000}")
  public void evictIdleSessions() {
    Instant cutoff = clock.instant().minus(enrichmentConfig.getSession().getIdleTimeout());
    sessions.values().stream()
        .filter(session -> session.getLastUsed().isBefore(cutoff))
        .map(EnrichmentSession::getId)
        .toList()
        .forEach(
            sessionId -> {
              EnrichmentSession session = sessions.remove(sessionId);
              if (session != null) {
                session.close();
                meterRegistry.counter("enrichment.session.evicted").increment();
                log.warn("Evicted idle enrichment session {}", sessionId);
              }
            });
  }
}
