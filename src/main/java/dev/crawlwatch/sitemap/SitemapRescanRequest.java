package dev.crawlwatch.sitemap;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Request to rescan a client's sitemap.
 *
 * @param projectId the client whose pages are reconciled
 * @param sitemapUrl sitemap to fetch; defaults to the last one used for the client
 */
public record SitemapRescanRequest(
    @JsonProperty("project_id") UUID projectId,
    @JsonProperty("sitemap_url") @Nullable String sitemapUrl) {}
