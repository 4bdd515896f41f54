package dev.crawlwatch.extraction;

/** Counters of a finished (or cancelled) batch extraction. */
public record BatchSummary(int total, int successful, int failed, int skipped, boolean cancelled) {

  public int processed() {
    return successful + failed + skipped;
  }
}
