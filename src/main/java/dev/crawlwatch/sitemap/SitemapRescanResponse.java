package dev.crawlwatch.sitemap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Result of a sitemap rescan, after the new and removed pages were recorded. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SitemapRescanResponse(
    List<String> newUrls,
    List<String> removedUrls,
    int newCount,
    int removedCount,
    int unchangedCount,
    int totalInSitemap,
    String message) {

  public SitemapRescanResponse {
    newUrls = newUrls == null ? List.of() : List.copyOf(newUrls);
    removedUrls = removedUrls == null ? List.of() : List.copyOf(removedUrls);
  }

  public static SitemapRescanResponse from(SitemapDiffResult diff) {
    return new SitemapRescanResponse(
        diff.newUrls(),
        diff.removedUrls(),
        diff.newUrls().size(),
        diff.removedUrls().size(),
        diff.unchangedCount(),
        diff.totalInSitemap(),
        diff.message());
  }
}
