package com.scholary.lecture.corrector.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Batch correction jobs run on a bounded thread pool sized from {@code corrector.batch}.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(CorrectionProperties properties) {
    CorrectionProperties.BatchProperties batch = properties.batch();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(batch.asyncExecutorThreads());
    executor.setMaxPoolSize(batch.asyncExecutorThreads());
    executor.setQueueCapacity(batch.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("correction-");
    executor.initialize();
    return executor;
  }
}
