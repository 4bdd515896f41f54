package dev.crawlwatch.extraction;

/**
 * A classified per-page failure.
 *
 * @param category what kind of failure this is
 * @param retryable whether another attempt is worth making
 * @param message human-readable message stored as the page's last error
 */
public record ClassifiedError(ErrorCategory category, boolean retryable, String message) {}
