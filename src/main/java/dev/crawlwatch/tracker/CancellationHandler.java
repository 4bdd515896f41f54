package dev.crawlwatch.tracker;

import dev.crawlwatch.job.EngineUnavailableException;
import dev.crawlwatch.job.JobSnapshot;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Forwards cancel requests to the engine without waiting for the job to stop.
 *
 * <p>The returned snapshot is whatever the engine reports; the job stays {@code RUNNING} until the
 * engine confirms {@code CANCELLED} through polling. Cancelling a job already known to be terminal
 * returns its snapshot without contacting the engine. When the engine is unreachable the request
 * is queued and retried on the job's next poll tick.
 */
@Service
public class CancellationHandler {

  private static final Logger log = LoggerFactory.getLogger(CancellationHandler.class);

  private final ExtractionEngine engine;
  private final JobStatusPoller poller;
  private final ProgressObserverBridge bridge;
  private final Set<UUID> pendingCancels = ConcurrentHashMap.newKeySet();

  public CancellationHandler(
      ExtractionEngine engine, JobStatusPoller poller, ProgressObserverBridge bridge) {
    this.engine = engine;
    this.poller = poller;
    this.bridge = bridge;
    poller.addTickListener(this::retryPendingCancel);
    bridge.subscribeAll(
        new JobObserver() {
          @Override
          public void onSnapshot(JobSnapshot snapshot) {}

          @Override
          public void onTerminal(JobSnapshot snapshot) {
            pendingCancels.remove(snapshot.id());
          }
        });
  }

  /**
   * Request cancellation of a job.
   *
   * @return the last known terminal snapshot, the engine's answer, or (engine unreachable) the
   *     last known snapshot
   * @throws EngineUnavailableException if the engine is unreachable and nothing is known locally
   */
  public JobSnapshot cancel(UUID jobId) {
    Optional<JobSnapshot> lastKnown = lastKnown(jobId);
    if (lastKnown.isPresent() && lastKnown.get().isTerminal()) {
      log.debug("Job {} already {}; cancel ignored", jobId, lastKnown.get().status());
      return lastKnown.get();
    }

    try {
      JobSnapshot snapshot = engine.cancel(jobId);
      pendingCancels.remove(jobId);
      log.info("Cancel sent for job {} (engine reports {})", jobId, snapshot.status());
      poller.startPolling(jobId);
      return snapshot;
    } catch (EngineUnavailableException e) {
      pendingCancels.add(jobId);
      poller.startPolling(jobId);
      log.warn("Engine unavailable, cancel of job {} queued: {}", jobId, e.getMessage());
      return lastKnown.orElseThrow(() -> e);
    }
  }

  public boolean isCancelPending(UUID jobId) {
    return pendingCancels.contains(jobId);
  }

  void retryPendingCancel(JobSnapshot snapshot) {
    UUID jobId = snapshot.id();
    if (!pendingCancels.contains(jobId)) {
      return;
    }
    if (snapshot.isTerminal()) {
      pendingCancels.remove(jobId);
      return;
    }
    try {
      engine.cancel(jobId);
      pendingCancels.remove(jobId);
      log.info("Queued cancel delivered for job {}", jobId);
    } catch (EngineUnavailableException e) {
      log.debug("Engine still unavailable, cancel of job {} stays queued", jobId);
    } catch (RuntimeException e) {
      pendingCancels.remove(jobId);
      log.warn("Queued cancel of job {} rejected: {}", jobId, e.getMessage());
    }
  }

  private Optional<JobSnapshot> lastKnown(UUID jobId) {
    Optional<JobSnapshot> delivered = bridge.lastDelivered(jobId);
    if (delivered.isPresent()) {
      return delivered;
    }
    return poller.getSession(jobId).flatMap(PollingSession::lastSnapshot);
  }
}
