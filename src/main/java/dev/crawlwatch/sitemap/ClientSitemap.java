package dev.crawlwatch.sitemap;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Last sitemap URL used for a client. Maps to the {@code client_sitemaps} table. */
@Entity
@Table(name = "client_sitemaps")
public class ClientSitemap {

  @Id
  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "sitemap_url", nullable = false, columnDefinition = "text")
  private String sitemapUrl;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ClientSitemap() {
    // JPA requires no-arg constructor
  }

  public ClientSitemap(UUID clientId, String sitemapUrl) {
    this.clientId = clientId;
    this.sitemapUrl = sitemapUrl;
  }

  @PrePersist
  @PreUpdate
  protected void touch() {
    this.updatedAt = Instant.now();
  }

  public UUID getClientId() {
    return clientId;
  }

  public String getSitemapUrl() {
    return sitemapUrl;
  }

  public void setSitemapUrl(String sitemapUrl) {
    this.sitemapUrl = sitemapUrl;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
