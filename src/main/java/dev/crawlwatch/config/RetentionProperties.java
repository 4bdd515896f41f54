package dev.crawlwatch.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * How long finished jobs stay in memory, bound from {@code crawlwatch.retention.*}.
 *
 * <ul>
 *   <li>{@code finished-jobs} - age after which a finished job is forgotten (default 1h)
 *   <li>{@code cleanup-interval} - delay between two cleanup runs (default 5m)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "crawlwatch.retention")
public class RetentionProperties {

  private Duration finishedJobs = Duration.ofHours(1);
  private Duration cleanupInterval = Duration.ofMinutes(5);

  @PostConstruct
  void validate() {
    if (finishedJobs == null || finishedJobs.isNegative()) {
      throw new IllegalStateException(
          "crawlwatch.retention.finished-jobs must not be negative, got: " + finishedJobs);
    }
    if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
      throw new IllegalStateException(
          "crawlwatch.retention.cleanup-interval must be positive, got: " + cleanupInterval);
    }
  }

  public Duration getFinishedJobs() {
    return finishedJobs;
  }

  public void setFinishedJobs(Duration finishedJobs) {
    this.finishedJobs = finishedJobs;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
  }
}
