package dev.crawlwatch.page;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Read-only view of a {@link PageRecord} returned by the page listing endpoint. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageSummary(
    UUID id,
    String url,
    String slug,
    PageStatus status,
    @Nullable String extractionMethod,
    @Nullable Instant lastCrawledAt,
    int versionCount,
    boolean hasContent,
    @Nullable String lastError,
    boolean inSitemap,
    @Nullable Instant removedFromSitemapAt) {

  public static PageSummary from(PageRecord page) {
    return new PageSummary(
        page.getId(),
        page.getUrl(),
        page.getSlug(),
        page.getStatus(),
        page.getExtractionMethod(),
        page.getLastCrawledAt(),
        page.getVersionCount(),
        page.getCurrentData() != null && !page.getCurrentData().isBlank(),
        page.getLastError(),
        page.isInSitemap(),
        page.getRemovedFromSitemapAt());
  }
}
