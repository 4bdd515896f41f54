package dev.crawlwatch.config;

import dev.crawlwatch.extraction.ExtractionProperties;
import dev.crawlwatch.tracker.TrackerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the application.
 *
 * <ul>
 *   <li>{@code trackerTaskScheduler}: status polling ticks
 *   <li>{@code jobTaskExecutor}: whole engine jobs, one thread each
 *   <li>{@code extractionTaskExecutor}: extraction units and method trials
 *   <li>{@code sseTaskExecutor}: writes to event-stream clients
 * </ul>
 *
 * <p>{@code @Scheduled} maintenance tasks share the tracker scheduler.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

  @Bean
  public ThreadPoolTaskScheduler trackerTaskScheduler(TrackerProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.getSchedulerPoolSize());
    scheduler.setThreadNamePrefix("tracker-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor jobTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("job-");
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor extractionTaskExecutor(ExtractionProperties properties) {
    int threads = Math.max(4, properties.getConcurrency() * 2);
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("extract-");
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor sseTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("sse-");
    return executor;
  }
}
