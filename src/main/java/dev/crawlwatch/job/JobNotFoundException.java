package dev.crawlwatch.job;

import java.util.UUID;

/** Thrown when a job id is not known to the engine. */
public class JobNotFoundException extends RuntimeException {

  private final UUID jobId;

  public JobNotFoundException(UUID jobId) {
    super("Job " + jobId + " not found");
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }
}
