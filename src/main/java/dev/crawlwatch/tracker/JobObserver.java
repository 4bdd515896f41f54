package dev.crawlwatch.tracker;

import dev.crawlwatch.job.JobSnapshot;

/**
 * Receives the snapshots of a job in delivery order. {@link #onTerminal(JobSnapshot)} is called
 * exactly once, right after the terminal snapshot was passed to {@link #onSnapshot(JobSnapshot)}.
 */
public interface JobObserver {

  void onSnapshot(JobSnapshot snapshot);

  default void onTerminal(JobSnapshot snapshot) {}
}
