package dev.crawlwatch.job;

/** Phase of a job's work. Only {@link JobType#CRAWL} jobs go through all three running phases. */
public enum JobPhase {
  DISCOVERING,
  TESTING,
  EXTRACTING,
  COMPLETED,
  FAILED
}
