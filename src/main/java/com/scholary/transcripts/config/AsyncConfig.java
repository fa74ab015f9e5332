package com.scholary.transcripts.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async acquisition jobs.
 *
 * <p>Each job runs one acquisition end to end on a single thread; the pool bounds how many content
 * items are worked on at once, and the queue bounds how many wait.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "acquisitionExecutor")
  public Executor acquisitionExecutor(AcquisitionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("acquisition-");
    executor.initialize();
    return executor;
  }
}
