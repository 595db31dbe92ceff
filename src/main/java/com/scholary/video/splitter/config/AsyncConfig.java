package com.scholary.video.splitter.config;

import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for split job execution.
 *
 * <p>Sets up a fixed-size worker pool. Jobs beyond the pool size wait in a FIFO queue. On
 * shutdown the pool stops taking work and does not wait for in-flight jobs; their records stay
 * {@code processing}.
 */
@Configuration
@EnableConfigurationProperties(SplitterProperties.class)
public class AsyncConfig {

  public static final String SPLIT_EXECUTOR = "splitExecutor";

  @Bean(name = SPLIT_EXECUTOR)
  public Executor splitExecutor(SplitterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("split-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
