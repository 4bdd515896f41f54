package dev.crawlwatch.extraction;

/**
 * One way of turning a page URL into Markdown, backed by an external HTTP service.
 *
 * <p>Implementations are Spring beans; every bean of this type takes part in the extraction method
 * selection race. {@link #name()} is the value stored as {@code PageRecord.extractionMethod} and
 * accepted as {@code extraction_method} in batch extraction requests.
 */
public interface ExtractionStrategy {

  /** Stable identifier, e.g. {@code "crawl4ai"}. */
  String name();

  /**
   * Extract a single page. Implementations report failures through the returned result; they may
   * still throw on programming errors, which callers treat as a failed page.
   */
  ExtractionResult extract(String url);
}
