package dev.crawlwatch.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Request to import a client's pages, either from a sitemap or from a manual URL list.
 *
 * @param clientId owner of the pages
 * @param setupType {@code "sitemap"} or {@code "manual"}
 * @param sitemapUrl required for sitemap setups
 * @param manualUrls required (non-empty) for manual setups
 */
public record StartSetupRequest(
    @NotNull @JsonProperty("client_id") UUID clientId,
    @NotNull
        @Pattern(regexp = "sitemap|manual", message = "must be 'sitemap' or 'manual'")
        @JsonProperty("setup_type")
        String setupType,
    @JsonProperty("sitemap_url") @Nullable String sitemapUrl,
    @JsonProperty("manual_urls") List<String> manualUrls) {

  public static final String SITEMAP = "sitemap";
  public static final String MANUAL = "manual";

  public StartSetupRequest {
    manualUrls = manualUrls == null ? List.of() : List.copyOf(manualUrls);
  }

  public boolean isSitemapSetup() {
    return SITEMAP.equals(setupType);
  }
}
