package dev.crawlwatch.tracker;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the job tracker, bound from {@code crawlwatch.tracker.*}.
 *
 * <ul>
 *   <li>{@code poll-interval} - delay between a status response and the next request (default 2s)
 *   <li>{@code scheduler-pool-size} - threads of the polling scheduler (default 2)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "crawlwatch.tracker")
public class TrackerProperties {

  private Duration pollInterval = Duration.ofMillis(2000);
  private int schedulerPoolSize = 2;

  @PostConstruct
  void validate() {
    if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalStateException(
          "crawlwatch.tracker.poll-interval must be positive, got: " + pollInterval);
    }
    if (schedulerPoolSize < 1) {
      throw new IllegalStateException(
          "crawlwatch.tracker.scheduler-pool-size must be >= 1, got: " + schedulerPoolSize);
    }
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getSchedulerPoolSize() {
    return schedulerPoolSize;
  }

  public void setSchedulerPoolSize(int schedulerPoolSize) {
    this.schedulerPoolSize = schedulerPoolSize;
  }
}
