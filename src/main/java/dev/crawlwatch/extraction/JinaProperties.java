package dev.crawlwatch.extraction;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Jina Reader endpoint settings, bound from {@code crawlwatch.jina.*}. */
@ConfigurationProperties(prefix = "crawlwatch.jina")
public record JinaProperties(String baseUrl, int readTimeoutMs, @Nullable String apiKey) {}
