package dev.crawlwatch.tracker;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the tracker finds the engine, bound from {@code crawlwatch.engine.*}.
 *
 * @param mode {@code local} (same process, default) or {@code remote}
 * @param baseUrl engine base URL in remote mode
 * @param connectTimeoutMs TCP connection timeout in milliseconds
 * @param readTimeoutMs response read timeout in milliseconds
 */
@ConfigurationProperties(prefix = "crawlwatch.engine")
public record EngineClientProperties(
    String mode, String baseUrl, int connectTimeoutMs, int readTimeoutMs) {}
