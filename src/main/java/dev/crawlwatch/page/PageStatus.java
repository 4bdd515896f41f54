package dev.crawlwatch.page;

/**
 * Lifecycle states for a {@link PageRecord}.
 *
 * <p>Normal flow: {@code DISCOVERED → TESTING → CRAWLING → CRAWLED}. Pages picked for a batch
 * extraction go straight from {@code DISCOVERED} (or {@code CRAWLED}) to {@code CRAWLING}. Any
 * extraction attempt may end in {@code FAILED}; a later pass can still move the page back to
 * {@code CRAWLED}.
 */
public enum PageStatus {
  /** Known URL, never extracted. */
  DISCOVERED,
  /** Part of the sample used to pick an extraction method. */
  TESTING,
  /** An extraction unit is in flight for this page. */
  CRAWLING,
  /** Content extracted and stored in {@code current_data}. */
  CRAWLED,
  /** Last extraction attempt failed; see {@code last_error}. */
  FAILED
}
