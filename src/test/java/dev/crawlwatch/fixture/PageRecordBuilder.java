package dev.crawlwatch.fixture;

import dev.crawlwatch.page.PageRecord;
import dev.crawlwatch.page.PageStatus;
import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link PageRecord} JPA entity. Provides sensible defaults so
 * tests only override what they care about.
 *
 * <pre>{@code
 * PageRecord page = new PageRecordBuilder().url("https://acme.example/pricing").build();
 * }</pre>
 */
public final class PageRecordBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private UUID clientId = UUID.fromString("00000000-0000-0000-0000-00000000c11e");
  private String url = "https://acme.example/about";
  private PageStatus status = PageStatus.DISCOVERED;
  private @Nullable String extractionMethod;
  private @Nullable Instant lastCrawledAt;
  private @Nullable String currentData;
  private @Nullable String contentHash;
  private int versionCount = 0;
  private boolean inSitemap = true;

  public PageRecordBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public PageRecordBuilder clientId(UUID clientId) {
    this.clientId = clientId;
    return this;
  }

  public PageRecordBuilder url(String url) {
    this.url = url;
    return this;
  }

  public PageRecordBuilder status(PageStatus status) {
    this.status = status;
    return this;
  }

  /** Marks the page as crawled by {@code method} at {@code crawledAt} with the given content. */
  public PageRecordBuilder crawled(String method, Instant crawledAt, String content, String hash) {
    this.status = PageStatus.CRAWLED;
    this.extractionMethod = method;
    this.lastCrawledAt = crawledAt;
    this.currentData = content;
    this.contentHash = hash;
    this.versionCount = 1;
    return this;
  }

  public PageRecordBuilder versionCount(int versionCount) {
    this.versionCount = versionCount;
    return this;
  }

  public PageRecordBuilder inSitemap(boolean inSitemap) {
    this.inSitemap = inSitemap;
    return this;
  }

  public PageRecord build() {
    PageRecord page = new PageRecord(clientId, url);
    if (id != null) {
      setField(page, "id", id);
    }
    page.setStatus(status);
    setField(page, "extractionMethod", extractionMethod);
    setField(page, "lastCrawledAt", lastCrawledAt);
    setField(page, "currentData", currentData);
    setField(page, "contentHash", contentHash);
    setField(page, "versionCount", versionCount);
    setField(page, "inSitemap", inSitemap);
    if (!inSitemap) {
      setField(page, "removedFromSitemapAt", Instant.parse("2026-01-01T00:00:00Z"));
    }
    return page;
  }

  private static void setField(PageRecord page, String fieldName, @Nullable Object value) {
    try {
      Field field = PageRecord.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(page, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
