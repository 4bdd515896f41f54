package dev.crawlwatch.extraction;

import java.util.List;
import java.util.UUID;

/**
 * What a batch extraction should do.
 *
 * @param clientId owner of the pages
 * @param urls normalized page URLs, no duplicates
 * @param method name of the {@link ExtractionStrategy} to use
 * @param force re-extract pages even if they are still fresh
 */
public record BatchPlan(UUID clientId, List<String> urls, String method, boolean force) {
  public BatchPlan {
    urls = urls == null ? List.of() : List.copyOf(urls);
  }
}
