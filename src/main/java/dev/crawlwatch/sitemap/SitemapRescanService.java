package dev.crawlwatch.sitemap;

import dev.crawlwatch.job.JobValidationException;
import dev.crawlwatch.page.PageRecord;
import dev.crawlwatch.page.PageRecordRepository;
import dev.crawlwatch.page.UrlNormalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Re-fetches a client's sitemap and records the difference against its known pages.
 *
 * <p>Soft policy: new URLs become {@code DISCOVERED} pages, pages missing from the sitemap are
 * flagged as removed but kept, and flagged pages that reappear are restored. Nothing is deleted.
 */
@Service
public class SitemapRescanService {

  private static final Logger log = LoggerFactory.getLogger(SitemapRescanService.class);

  private final SitemapFetcher sitemapFetcher;
  private final SitemapReconciler reconciler;
  private final PageRecordRepository pageRecordRepository;
  private final ClientSitemapRegistry sitemapRegistry;
  private final Clock clock;

  public SitemapRescanService(
      SitemapFetcher sitemapFetcher,
      SitemapReconciler reconciler,
      PageRecordRepository pageRecordRepository,
      ClientSitemapRegistry sitemapRegistry,
      Clock clock) {
    this.sitemapFetcher = sitemapFetcher;
    this.reconciler = reconciler;
    this.pageRecordRepository = pageRecordRepository;
    this.sitemapRegistry = sitemapRegistry;
    this.clock = clock;
  }

  /**
   * @param clientId client whose pages are reconciled
   * @param sitemapUrl sitemap to fetch, or null to reuse the last one used for this client
   * @throws JobValidationException if no sitemap URL is given or known
   * @throws SitemapFetchException if the sitemap cannot be fetched or parsed
   */
  @Transactional
  public SitemapRescanResponse rescan(UUID clientId, @Nullable String sitemapUrl) {
    if (clientId == null) {
      throw new JobValidationException("project_id is required");
    }
    String url = resolveSitemapUrl(clientId, sitemapUrl);
    Set<String> fresh = normalizeAll(sitemapFetcher.fetch(url));

    Map<String, PageRecord> known =
        pageRecordRepository.findAllByClientId(clientId).stream()
            .collect(Collectors.toMap(PageRecord::getUrl, Function.identity(), (a, b) -> a));

    SitemapDiffResult diff = reconciler.reconcile(known.keySet(), fresh);
    Instant now = clock.instant();

    for (String newUrl : diff.newUrls()) {
      pageRecordRepository.save(new PageRecord(clientId, newUrl));
    }
    for (String removedUrl : diff.removedUrls()) {
      known.get(removedUrl).markRemovedFromSitemap(now);
    }
    int restored = 0;
    for (String freshUrl : fresh) {
      PageRecord page = known.get(freshUrl);
      if (page != null && page.restoreToSitemap()) {
        restored++;
      }
    }
    sitemapRegistry.remember(clientId, url);

    log.info(
        "Rescanned sitemap {} for client {}: {} ({} restored)",
        url,
        clientId,
        diff.message(),
        restored);
    return SitemapRescanResponse.from(diff);
  }

  private String resolveSitemapUrl(UUID clientId, @Nullable String sitemapUrl) {
    if (sitemapUrl != null && !sitemapUrl.isBlank()) {
      if (!UrlNormalizer.isValidPageUrl(sitemapUrl)) {
        throw new JobValidationException("sitemap_url is not a valid http(s) URL: " + sitemapUrl);
      }
      return sitemapUrl.trim();
    }
    return sitemapRegistry
        .lookup(clientId)
        .orElseThrow(
            () ->
                new JobValidationException(
                    "No sitemap URL known for client " + clientId + "; provide sitemap_url"));
  }

  private static Set<String> normalizeAll(List<String> urls) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String url : urls) {
      if (UrlNormalizer.isValidPageUrl(url)) {
        normalized.add(UrlNormalizer.normalize(url));
      }
    }
    return normalized;
  }
}
