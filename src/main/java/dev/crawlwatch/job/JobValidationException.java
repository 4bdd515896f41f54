package dev.crawlwatch.job;

/** A start, cancel or rescan request the engine refuses to act on. Maps to HTTP 400. */
public class JobValidationException extends IllegalArgumentException {

  public JobValidationException(String message) {
    super(message);
  }
}
