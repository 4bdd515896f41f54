package dev.crawlwatch.config;

import dev.crawlwatch.job.PhaseStateMachine;
import dev.crawlwatch.tracker.JobStatusPoller;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically forgets jobs that finished before the retention window: engine snapshots, poller
 * sessions and their delivered progress.
 *
 * @see RetentionProperties
 */
@Component
public class FinishedJobCleanup {

  private static final Logger log = LoggerFactory.getLogger(FinishedJobCleanup.class);

  private final PhaseStateMachine stateMachine;
  private final JobStatusPoller poller;
  private final RetentionProperties properties;
  private final Clock clock;

  public FinishedJobCleanup(
      PhaseStateMachine stateMachine,
      JobStatusPoller poller,
      RetentionProperties properties,
      Clock clock) {
    this.stateMachine = stateMachine;
    this.poller = poller;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${crawlwatch.retention.cleanup-interval:PT5M}",
      initialDelayString = "${crawlwatch.retention.cleanup-interval:PT5M}")
  public void evictFinishedJobs() {
    Instant cutoff = clock.instant().minus(properties.getFinishedJobs());
    int engineJobs = stateMachine.evictFinishedBefore(cutoff);
    int trackedJobs = poller.evictFinishedBefore(cutoff);
    if (engineJobs > 0 || trackedJobs > 0) {
      log.info(
          "Retention cleanup forgot {} engine jobs and {} tracked jobs finished before {}",
          engineJobs,
          trackedJobs,
          cutoff);
    }
  }
}
