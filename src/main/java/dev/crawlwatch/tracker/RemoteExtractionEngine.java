package dev.crawlwatch.tracker;

import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.EngineUnavailableException;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.JobValidationException;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.sitemap.SitemapRescanRequest;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import java.util.UUID;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Engine reached over HTTP through another crawlwatch instance's engine API.
 *
 * <p>Maps HTTP failures onto the engine exceptions: 400 to {@link JobValidationException}, 404 to
 * {@link JobNotFoundException}, and connection errors or 5xx answers to {@link
 * EngineUnavailableException}. No retries here: the poller's next tick is the retry.
 */
@Component
@ConditionalOnProperty(name = "crawlwatch.engine.mode", havingValue = "remote")
public class RemoteExtractionEngine implements ExtractionEngine {

  private static final Logger log = LoggerFactory.getLogger(RemoteExtractionEngine.class);

  private final RestClient restClient;

  public RemoteExtractionEngine(@Qualifier("engineRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public StartJobResponse startSetup(StartSetupRequest request) {
    return call(null, () -> post("/api/engine/setup", request, StartJobResponse.class));
  }

  @Override
  public StartJobResponse startCrawl(StartCrawlRequest request) {
    return call(null, () -> post("/api/engine/crawl", request, StartJobResponse.class));
  }

  @Override
  public StartJobResponse startExtraction(BatchExtractionRequest request) {
    return call(null, () -> post("/api/engine/extraction", request, StartJobResponse.class));
  }

  @Override
  public JobSnapshot getStatus(UUID jobId) {
    return call(
        jobId,
        () ->
            restClient
                .get()
                .uri("/api/engine/jobs/{id}", jobId)
                .retrieve()
                .body(JobSnapshot.class));
  }

  @Override
  public JobSnapshot cancel(UUID jobId) {
    return call(
        jobId,
        () ->
            restClient
                .post()
                .uri("/api/engine/jobs/{id}/cancel", jobId)
                .retrieve()
                .body(JobSnapshot.class));
  }

  @Override
  public SitemapRescanResponse rescanSitemap(UUID clientId, @Nullable String sitemapUrl) {
    return call(
        null,
        () ->
            post(
                "/api/engine/sitemap/rescan",
                new SitemapRescanRequest(clientId, sitemapUrl),
                SitemapRescanResponse.class));
  }

  private <T> T post(String path, Object body, Class<T> responseType) {
    return restClient.post().uri(path).body(body).retrieve().body(responseType);
  }

  private <T> T call(@Nullable UUID jobId, Supplier<T> request) {
    T result;
    try {
      result = request.get();
    } catch (RestClientResponseException e) {
      throw translate(jobId, e);
    } catch (RestClientException e) {
      log.warn("Engine unreachable: {}", e.getMessage());
      throw new EngineUnavailableException("Engine unreachable: " + e.getMessage(), e);
    }
    if (result == null) {
      throw new EngineUnavailableException("Engine returned an empty response", null);
    }
    return result;
  }

  private RuntimeException translate(@Nullable UUID jobId, RestClientResponseException e) {
    int status = e.getStatusCode().value();
    if (status == HttpStatus.NOT_FOUND.value() && jobId != null) {
      return new JobNotFoundException(jobId);
    }
    if (e.getStatusCode().is4xxClientError()) {
      return new JobValidationException(detail(e));
    }
    log.warn("Engine answered {}: {}", status, e.getMessage());
    return new EngineUnavailableException("Engine answered " + status + ": " + detail(e), e);
  }

  private static String detail(RestClientResponseException e) {
    try {
      ProblemDetail problem = e.getResponseBodyAs(ProblemDetail.class);
      if (problem != null && problem.getDetail() != null) {
        return problem.getDetail();
      }
    } catch (RuntimeException parseError) {
      log.debug("Engine error body is not a problem detail: {}", parseError.getMessage());
    }
    return e.getStatusText();
  }
}
