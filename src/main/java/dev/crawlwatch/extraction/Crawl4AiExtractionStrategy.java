package dev.crawlwatch.extraction;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Extraction through the Crawl4AI sidecar: headless Chromium rendering plus boilerplate pruning.
 */
@Service
public class Crawl4AiExtractionStrategy implements ExtractionStrategy {

    public static final String NAME = "crawl4ai";

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiExtractionStrategy.class);

    private final RestClient restClient;

    public Crawl4AiExtractionStrategy(@Qualifier("crawl4AiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Crawl a single URL via Crawl4AI sidecar.
     * Retries on transient RestClientException with exponential backoff; 4xx answers are final.
     */
    @Override
    @Retryable(
            retryFor = RestClientException.class,
            noRetryFor = HttpClientErrorException.class,
            maxAttemptsExpression = "${crawlwatch.crawl4ai.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${crawlwatch.crawl4ai.retry.delay-ms}",
                    multiplierExpression = "${crawlwatch.crawl4ai.retry.multiplier}"
            )
    )
    public ExtractionResult extract(String url) {
        Crawl4AiRequest request = buildRequest(url);

        Crawl4AiResponse response = restClient.post()
                .uri("/crawl")
                .body(request)
                .retrieve()
                .body(Crawl4AiResponse.class);

        if (response == null || !response.success() || response.results().isEmpty()) {
            return ExtractionResult.failure(url, "Crawl4AI returned no results for " + url, null);
        }

        Crawl4AiPageResult page = response.results().get(0);
        if (!page.success()) {
            return ExtractionResult.failure(url, page.error_message(), page.status_code());
        }

        String markdown = extractMarkdown(page.markdown());
        if (markdown == null || markdown.isBlank()) {
            return ExtractionResult.failure(url, "Crawl4AI returned empty content", page.status_code());
        }
        return ExtractionResult.success(url, markdown);
    }

    @Recover
    ExtractionResult recoverExtract(RestClientException e, String url) {
        log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
        Integer statusCode = e instanceof HttpStatusCodeException statusError
                ? statusError.getStatusCode().value()
                : null;
        return ExtractionResult.failure(url, e.getMessage(), statusCode);
    }

    /**
     * Prefer fitMarkdown (boilerplate-removed) over rawMarkdown.
     */
    private String extractMarkdown(Crawl4AiMarkdown markdown) {
        if (markdown == null) {
            return null;
        }
        if (markdown.fitMarkdown() != null && !markdown.fitMarkdown().isBlank()) {
            return markdown.fitMarkdown();
        }
        return markdown.rawMarkdown();
    }

    private Crawl4AiRequest buildRequest(String url) {
        return new Crawl4AiRequest(
                List.of(url),
                Map.of("type", "BrowserConfig", "params", Map.of("headless", true)),
                Map.of("type", "CrawlerRunConfig", "params", Map.of(
                        "cache_mode", "bypass",
                        "excluded_tags", List.of("nav", "footer", "header", "aside"),
                        "markdown_generator", Map.of(
                                "type", "DefaultMarkdownGenerator",
                                "params", Map.of(
                                        "content_filter", Map.of(
                                                "type", "PruningContentFilter",
                                                "params", Map.of("threshold", 0.48, "min_word_threshold", 10)
                                        )
                                )
                        )
                ))
        );
    }
}
