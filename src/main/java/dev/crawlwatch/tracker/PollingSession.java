package dev.crawlwatch.tracker;

import dev.crawlwatch.job.JobSnapshot;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polling state of one job. Owned by {@link JobStatusPoller}; sessions of different jobs share
 * nothing.
 */
public final class PollingSession {

  private final UUID jobId;
  private final CompletableFuture<JobSnapshot> terminal = new CompletableFuture<>();
  private final AtomicReference<JobSnapshot> lastSnapshot = new AtomicReference<>();
  private final AtomicInteger requestCount = new AtomicInteger();
  private volatile ScheduledFuture<?> nextTick;
  private volatile boolean active = true;
  private volatile Instant finishedAt;

  PollingSession(UUID jobId) {
    this.jobId = jobId;
  }

  public UUID jobId() {
    return jobId;
  }

  /** Completes with the terminal snapshot, or exceptionally if the job turned out to be unknown. */
  public CompletableFuture<JobSnapshot> terminal() {
    return terminal;
  }

  /** Last snapshot received from the engine; untouched by failed polls. */
  public Optional<JobSnapshot> lastSnapshot() {
    return Optional.ofNullable(lastSnapshot.get());
  }

  public boolean isActive() {
    return active;
  }

  /** Status requests issued so far, successful or not. */
  public int requestCount() {
    return requestCount.get();
  }

  void recordRequest() {
    requestCount.incrementAndGet();
  }

  void record(JobSnapshot snapshot) {
    lastSnapshot.set(snapshot);
  }

  void scheduled(ScheduledFuture<?> future) {
    this.nextTick = future;
  }

  /** When the terminal snapshot arrived; null while the job is not finished. */
  Instant finishedAt() {
    return finishedAt;
  }

  void complete(JobSnapshot snapshot, Instant at) {
    active = false;
    finishedAt = at;
    terminal.complete(snapshot);
  }

  void fail(Throwable error) {
    active = false;
    terminal.completeExceptionally(error);
  }

  void stop() {
    active = false;
    ScheduledFuture<?> tick = nextTick;
    if (tick != null) {
      tick.cancel(false);
    }
    terminal.cancel(false);
  }
}
