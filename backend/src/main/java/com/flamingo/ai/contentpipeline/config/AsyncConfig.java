package com.flamingo.ai.contentpipeline.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
public class AsyncConfig {

  /** Runs pipeline runs in the background; each run stays on one thread for its whole life. */
  @Bean(name = "pipelineRunExecutor")
  public Executor pipelineRunExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("pipeline-run-");
    executor.initialize();
    return executor;
  }
}
