package dev.crawlwatch.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Request to crawl a client's site. Without a sitemap URL the crawl works on the pages already
 * known for the client.
 */
public record StartCrawlRequest(
    @NotNull @JsonProperty("client_id") UUID clientId,
    @JsonProperty("sitemap_url") @Nullable String sitemapUrl) {}
