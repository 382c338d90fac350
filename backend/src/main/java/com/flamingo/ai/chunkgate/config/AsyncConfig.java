package com.flamingo.ai.chunkgate.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for concurrent chunk assessment. */
@Configuration
public class AsyncConfig {

  @Bean(name = "assessmentExecutor")
  public Executor assessmentExecutor(ChunkFilterConfig chunkFilterConfig) {
    ChunkFilterConfig.Executor settings = chunkFilterConfig.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix("chunk-assess-");
    // A saturated pool runs the assessment on the batch thread instead of rejecting it
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
