package dev.crawlwatch.sitemap;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Pure set difference between the URLs already known and a fresh sitemap listing. No I/O, no
 * normalization: callers pass URLs in the form they are stored.
 */
@Component
public class SitemapReconciler {

  /**
   * @param oldUrls URLs known before the rescan
   * @param freshUrls URLs listed by the sitemap now, duplicates allowed
   * @return new and removed URLs (disjoint) with the unchanged count
   */
  public SitemapDiffResult reconcile(Set<String> oldUrls, Collection<String> freshUrls) {
    Set<String> fresh = new HashSet<>(freshUrls);

    List<String> newUrls = fresh.stream().filter(url -> !oldUrls.contains(url)).sorted().toList();
    List<String> removedUrls =
        oldUrls.stream().filter(url -> !fresh.contains(url)).sorted().toList();
    int unchanged = fresh.size() - newUrls.size();

    return new SitemapDiffResult(
        newUrls, removedUrls, unchanged, fresh.size(), summarize(newUrls, removedUrls, unchanged));
  }

  private static String summarize(List<String> newUrls, List<String> removedUrls, int unchanged) {
    if (newUrls.isEmpty() && removedUrls.isEmpty()) {
      return "Sitemap unchanged (%d pages)".formatted(unchanged);
    }
    return "Found %d new and %d removed pages (%d unchanged)"
        .formatted(newUrls.size(), removedUrls.size(), unchanged);
  }
}
