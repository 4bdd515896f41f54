package dev.crawlwatch.tracker;

import dev.crawlwatch.job.JobSnapshot;

/** Called by {@link JobStatusPoller} after each successful poll of a job that is still running. */
@FunctionalInterface
public interface PollTickListener {

  void onTick(JobSnapshot snapshot);
}
