package com.flamingo.ai.studybuddy.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for engine generations. Workers drive generation sources; delivery threads drain
 * token channels into sinks.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final EngineConfig engineConfig;

  @Bean(name = "generationWorkerExecutor")
  public ThreadPoolTaskExecutor generationWorkerExecutor() {
    return buildExecutor(engineConfig.getWorker());
  }

  @Bean(name = "tokenDeliveryExecutor")
  public ThreadPoolTaskExecutor tokenDeliveryExecutor() {
    return buildExecutor(engineConfig.getDelivery());
  }

  private ThreadPoolTaskExecutor buildExecutor(EngineConfig.Executor settings) {
    return buildExecutor(
        settings, (int) Math.max(1, engineConfig.getShutdownTimeoutMs() / 1000));
  }

  /**
   * Builds and initializes a pool. With a queue capacity of 0 the pool hands each task straight to
   * a thread, growing up to {@code maxPoolSize}, and rejects tasks beyond that.
   */
  static ThreadPoolTaskExecutor buildExecutor(
      EngineConfig.Executor settings, int awaitTerminationSeconds) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix(settings.getThreadNamePrefix());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    return executor;
  }
}
