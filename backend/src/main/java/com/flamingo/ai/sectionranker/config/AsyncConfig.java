package com.flamingo.ai.sectionranker.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the executor used to parse documents and embed sections concurrently. */
@Configuration
public class AsyncConfig {

  public static final String RANKING_EXECUTOR = "sectionRankingExecutor";

  @Bean(name = RANKING_EXECUTOR)
  public Executor sectionRankingExecutor(RankingConfig rankingConfig) {
    RankingConfig.Parallelism parallelism = rankingConfig.getParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism.getCorePoolSize());
    executor.setMaxPoolSize(parallelism.getMaxPoolSize());
    executor.setQueueCapacity(parallelism.getQueueCapacity());
    executor.setThreadNamePrefix("rank-");
    // a full queue runs the task on the submitting thread instead of rejecting it
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
