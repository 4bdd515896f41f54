package dev.crawlwatch.page;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A page of a client site known to the engine.
 *
 * <p>Created the first time its URL is discovered (sitemap, manual import or batch extraction
 * request) and mutated by every extraction pass and sitemap rescan. Pages dropped from the sitemap
 * are kept and flagged with {@link #markRemovedFromSitemap(Instant)}; nothing in the engine
 * deletes them.
 *
 * <p>Maps to the {@code page_records} table managed by Flyway migrations. The unique constraint on
 * {@code (client_id, url)} keeps one record per normalized URL per client.
 *
 * @see PageStatus
 * @see PageRecordRepository
 */
@Entity
@Table(
    name = "page_records",
    uniqueConstraints = @UniqueConstraint(columnNames = {"client_id", "url"}))
public class PageRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(nullable = false, columnDefinition = "text")
  private String url;

  @Column(nullable = false, columnDefinition = "text")
  private String slug;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private PageStatus status = PageStatus.DISCOVERED;

  @Column(name = "extraction_method")
  private String extractionMethod;

  @Column(name = "last_crawled_at")
  private Instant lastCrawledAt;

  @Column(name = "version_count", nullable = false)
  private int versionCount;

  @Column(name = "current_data", columnDefinition = "text")
  private String currentData;

  @Column(name = "content_hash")
  private String contentHash;

  @Column(name = "last_error", columnDefinition = "text")
  private String lastError;

  @Column(name = "in_sitemap", nullable = false)
  private boolean inSitemap = true;

  @Column(name = "removed_from_sitemap_at")
  private Instant removedFromSitemapAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PageRecord() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a newly discovered page. The slug is derived from the URL path.
   *
   * @param clientId the owning client
   * @param url the normalized page URL
   */
  public PageRecord(UUID clientId, String url) {
    this.clientId = clientId;
    this.url = url;
    this.slug = UrlNormalizer.slugOf(url);
    this.versionCount = 0;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /**
   * Stores the result of a successful extraction. The version count only moves when the content
   * hash differs from the stored one.
   *
   * @return true if the content changed (or the page had no content yet)
   */
  public boolean recordExtraction(
      String method, @Nullable String content, String hash, Instant crawledAt) {
    boolean changed = !hash.equals(contentHash);
    if (changed) {
      this.currentData = content;
      this.contentHash = hash;
      this.versionCount++;
    }
    this.status = PageStatus.CRAWLED;
    this.extractionMethod = method;
    this.lastCrawledAt = crawledAt;
    this.lastError = null;
    return changed;
  }

  public void recordFailure(String errorMessage) {
    this.status = PageStatus.FAILED;
    this.lastError = errorMessage;
  }

  /**
   * Whether a previous pass with the same method is recent enough to skip this page without any
   * network work.
   */
  public boolean isFreshFor(String method, Instant now, Duration freshnessWindow) {
    return status == PageStatus.CRAWLED
        && method.equals(extractionMethod)
        && lastCrawledAt != null
        && !lastCrawledAt.isBefore(now.minus(freshnessWindow));
  }

  public void markRemovedFromSitemap(Instant removedAt) {
    if (inSitemap) {
      this.inSitemap = false;
      this.removedFromSitemapAt = removedAt;
    }
  }

  /** @return true if the page was flagged as removed and is now restored */
  public boolean restoreToSitemap() {
    if (inSitemap) {
      return false;
    }
    this.inSitemap = true;
    this.removedFromSitemapAt = null;
    return true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getClientId() {
    return clientId;
  }

  public String getUrl() {
    return url;
  }

  public String getSlug() {
    return slug;
  }

  public PageStatus getStatus() {
    return status;
  }

  public void setStatus(PageStatus status) {
    this.status = status;
  }

  public String getExtractionMethod() {
    return extractionMethod;
  }

  public Instant getLastCrawledAt() {
    return lastCrawledAt;
  }

  public int getVersionCount() {
    return versionCount;
  }

  public String getCurrentData() {
    return currentData;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getLastError() {
    return lastError;
  }

  public boolean isInSitemap() {
    return inSitemap;
  }

  public Instant getRemovedFromSitemapAt() {
    return removedFromSitemapAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
