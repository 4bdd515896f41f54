package dev.crawlwatch.sitemap;

/** The sitemap could not be downloaded, was too large, or could not be parsed. */
public class SitemapFetchException extends RuntimeException {

  public SitemapFetchException(String message) {
    super(message);
  }

  public SitemapFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
