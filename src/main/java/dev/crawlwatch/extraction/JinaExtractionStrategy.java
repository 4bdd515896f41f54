package dev.crawlwatch.extraction;

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
 * Extraction through the Jina Reader API, which answers {@code GET /{url}} with the page rendered
 * as Markdown.
 */
@Service
public class JinaExtractionStrategy implements ExtractionStrategy {

  public static final String NAME = "jina";

  private static final Logger log = LoggerFactory.getLogger(JinaExtractionStrategy.class);

  private final RestClient restClient;

  public JinaExtractionStrategy(@Qualifier("jinaRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      noRetryFor = HttpClientErrorException.class,
      maxAttemptsExpression = "${crawlwatch.crawl4ai.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${crawlwatch.crawl4ai.retry.delay-ms}",
              multiplierExpression = "${crawlwatch.crawl4ai.retry.multiplier}"))
  public ExtractionResult extract(String url) {
    String markdown = restClient.get().uri("/" + url).retrieve().body(String.class);
    if (markdown == null || markdown.isBlank()) {
      return ExtractionResult.failure(url, "Jina Reader returned empty content", null);
    }
    return ExtractionResult.success(url, markdown);
  }

  @Recover
  ExtractionResult recoverExtract(RestClientException e, String url) {
    log.warn("Jina Reader request failed after retries for {}: {}", url, e.getMessage());
    Integer statusCode =
        e instanceof HttpStatusCodeException statusError
            ? statusError.getStatusCode().value()
            : null;
    return ExtractionResult.failure(url, e.getMessage(), statusCode);
  }
}
