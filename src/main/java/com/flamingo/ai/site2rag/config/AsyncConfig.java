package com.flamingo.ai.site2rag.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the enrichment worker pool and scheduled housekeeping. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /**
   * Pool running batch enrichment tasks. Sized to the session concurrency limit; the per-session
   * semaphore still bounds in-flight provider calls. A full queue runs the batch on the submitting
   * thread.
   */
  @Bean(name = "enrichmentExecutor")
  public Executor enrichmentExecutor(EnrichmentConfig enrichmentConfig) {
    int limit = Math.max(1, enrichmentConfig.getSession().getConcurrencyLimit());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(limit);
    executor.setMaxPoolSize(limit * 2);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("enrich-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
