package dev.crawlwatch.sitemap;

import java.util.List;

/**
 * Difference between the URLs known for a client and a freshly fetched sitemap.
 *
 * @param newUrls URLs in the sitemap but not known yet, sorted
 * @param removedUrls known URLs missing from the sitemap, sorted
 * @param unchangedCount URLs present on both sides
 * @param totalInSitemap distinct URLs in the sitemap
 * @param message one-line summary
 */
public record SitemapDiffResult(
    List<String> newUrls,
    List<String> removedUrls,
    int unchangedCount,
    int totalInSitemap,
    String message) {

  public SitemapDiffResult {
    newUrls = newUrls == null ? List.of() : List.copyOf(newUrls);
    removedUrls = removedUrls == null ? List.of() : List.copyOf(removedUrls);
  }

  public boolean hasChanges() {
    return !newUrls.isEmpty() || !removedUrls.isEmpty();
  }
}
