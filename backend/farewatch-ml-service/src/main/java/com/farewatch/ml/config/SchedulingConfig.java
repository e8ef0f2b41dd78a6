package com.farewatch.ml.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  // One thread: fits are CPU-bound and must not pile up behind each other.
  @Bean(name = "trainingExecutor")
  public ThreadPoolTaskExecutor trainingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("model-training-");
    executor.setDaemon(true);
    executor.initialize();
    return executor;
  }

  @Bean(name = "retrainingTaskScheduler")
  public ThreadPoolTaskScheduler retrainingTaskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("retraining-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
