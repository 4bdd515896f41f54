package dev.crawlwatch.tracker;

import dev.crawlwatch.job.EngineUnavailableException;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.JobValidationException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Polls the engine for job status at a fixed cadence until the job is terminal.
 *
 * <p>The first request is scheduled immediately; each following one is scheduled {@code
 * crawlwatch.tracker.poll-interval} after the previous response, so at most one request per job
 * is outstanding. Every snapshot received is published to the {@link ProgressObserverBridge}.
 * Once a terminal snapshot arrives the session ends and no further request is made for that job.
 *
 * <p>Finished sessions are retained until {@link #evictFinishedBefore(Instant)} drops them, so a
 * later {@link #startPolling(UUID)} for a finished job returns the finished session and issues no
 * request.
 *
 * <p>A transient {@link EngineUnavailableException} keeps the last snapshot and the schedule. An
 * unknown job id ends the session exceptionally.
 */
@Service
public class JobStatusPoller {

  private static final Logger log = LoggerFactory.getLogger(JobStatusPoller.class);

  private final ConcurrentHashMap<UUID, PollingSession> sessions = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, PollingSession> finished = new ConcurrentHashMap<>();
  private final List<PollTickListener> tickListeners = new CopyOnWriteArrayList<>();
  private final ExtractionEngine engine;
  private final ProgressObserverBridge bridge;
  private final TaskScheduler scheduler;
  private final Duration pollInterval;
  private final Clock clock;

  public JobStatusPoller(
      ExtractionEngine engine,
      ProgressObserverBridge bridge,
      @Qualifier("trackerTaskScheduler") TaskScheduler scheduler,
      TrackerProperties properties,
      Clock clock) {
    this.engine = engine;
    this.bridge = bridge;
    this.scheduler = scheduler;
    this.pollInterval = properties.getPollInterval();
    this.clock = clock;
  }

  /**
   * Start polling a job, or return the session already polling it, or the finished session of a
   * job that already reached a terminal status.
   *
   * @param jobId job to follow
   * @return the job's single session
   */
  public PollingSession startPolling(UUID jobId) {
    PollingSession done = finished.get(jobId);
    if (done != null) {
      return done;
    }
    PollingSession created = new PollingSession(jobId);
    PollingSession existing = sessions.putIfAbsent(jobId, created);
    if (existing != null) {
      return existing;
    }
    // a session of the same job may have finished between the two lookups
    done = finished.get(jobId);
    if (done != null) {
      sessions.remove(jobId, created);
      return done;
    }
    log.debug("Polling job {} every {}", jobId, pollInterval);
    created.scheduled(scheduler.schedule(() -> tick(created), clock.instant()));
    return created;
  }

  /** Stop polling a job without waiting for a terminal status. */
  public void stopPolling(UUID jobId) {
    PollingSession session = sessions.remove(jobId);
    if (session != null) {
      session.stop();
      log.debug("Stopped polling job {}", jobId);
    }
  }

  public Optional<PollingSession> getSession(UUID jobId) {
    return Optional.ofNullable(sessions.get(jobId));
  }

  /** Whether a terminal status was received for this job and is still retained. */
  public boolean isFinished(UUID jobId) {
    return finished.containsKey(jobId);
  }

  /**
   * Forget jobs that finished before the cutoff, along with their delivered snapshots.
   *
   * @return number of jobs forgotten
   */
  public int evictFinishedBefore(Instant cutoff) {
    int evicted = 0;
    for (PollingSession session : List.copyOf(finished.values())) {
      if (session.finishedAt().isBefore(cutoff) && finished.remove(session.jobId(), session)) {
        bridge.forget(session.jobId());
        evicted++;
      }
    }
    if (evicted > 0) {
      log.debug("Evicted {} finished jobs from the poller", evicted);
    }
    return evicted;
  }

  public int activeSessionCount() {
    return sessions.size();
  }

  public void addTickListener(PollTickListener listener) {
    tickListeners.add(listener);
  }

  @PreDestroy
  void shutdown() {
    for (UUID jobId : List.copyOf(sessions.keySet())) {
      stopPolling(jobId);
    }
  }

  void tick(PollingSession session) {
    if (!session.isActive()) {
      return;
    }
    UUID jobId = session.jobId();
    JobSnapshot snapshot;
    session.recordRequest();
    try {
      snapshot = engine.getStatus(jobId);
    } catch (EngineUnavailableException e) {
      log.warn("Engine unavailable while polling job {}: {}", jobId, e.getMessage());
      scheduleNext(session);
      return;
    } catch (JobNotFoundException | JobValidationException e) {
      log.warn("Stopped polling job {}: {}", jobId, e.getMessage());
      sessions.remove(jobId, session);
      bridge.forget(jobId);
      session.fail(e);
      return;
    } catch (RuntimeException e) {
      log.error("Unexpected error while polling job {}: {}", jobId, e.getMessage(), e);
      scheduleNext(session);
      return;
    }

    session.record(snapshot);
    bridge.publish(snapshot);

    if (snapshot.isTerminal()) {
      session.complete(snapshot, clock.instant());
      finished.put(jobId, session);
      sessions.remove(jobId, session);
      log.info("Job {} reached {}; polling stopped", jobId, snapshot.status());
      return;
    }

    for (PollTickListener listener : tickListeners) {
      try {
        listener.onTick(snapshot);
      } catch (RuntimeException e) {
        log.warn("Poll tick listener failed for job {}: {}", jobId, e.getMessage(), e);
      }
    }
    scheduleNext(session);
  }

  private void scheduleNext(PollingSession session) {
    if (!session.isActive()) {
      return;
    }
    ScheduledFuture<?> next =
        scheduler.schedule(() -> tick(session), clock.instant().plus(pollInterval));
    session.scheduled(next);
  }
}
