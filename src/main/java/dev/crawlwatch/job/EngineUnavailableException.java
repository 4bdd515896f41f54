package dev.crawlwatch.job;

/**
 * The engine could not be reached or answered with a server error. Transient: callers retry on
 * their next tick instead of failing the job.
 */
public class EngineUnavailableException extends RuntimeException {

  public EngineUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
