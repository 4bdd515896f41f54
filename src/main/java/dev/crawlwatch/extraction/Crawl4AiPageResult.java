package dev.crawlwatch.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Per-page result within a {@link Crawl4AiResponse}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    @Nullable Integer status_code,
    @Nullable Crawl4AiMarkdown markdown,
    @Nullable String error_message) {}
