package dev.crawlwatch.job;

/** Kind of long-running job the engine executes. */
public enum JobType {
  /** Imports a client's pages from a sitemap or a manual URL list. */
  ENGINE_SETUP,
  /** Discovers pages, selects an extraction method on a sample, then extracts everything. */
  CRAWL,
  /** Extracts an explicit list of pages with a given method. */
  EXTRACTION
}
