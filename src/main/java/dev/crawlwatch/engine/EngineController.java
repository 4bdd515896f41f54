package dev.crawlwatch.engine;

import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.page.PageSummary;
import dev.crawlwatch.sitemap.SitemapRescanRequest;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engine HTTP API. Start endpoints answer {@code 202 Accepted} with the job id; the job runs in
 * the background and is followed through {@code GET /api/engine/jobs/{id}}.
 *
 * <p>Errors are mapped by {@link dev.crawlwatch.config.GlobalExceptionHandler}: validation errors
 * to 400, unknown jobs to 404.
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

  private final JobExecutionService jobExecutionService;

  public EngineController(JobExecutionService jobExecutionService) {
    this.jobExecutionService = jobExecutionService;
  }

  @PostMapping("/setup")
  public ResponseEntity<StartJobResponse> startSetup(@RequestBody StartSetupRequest request) {
    return ResponseEntity.accepted().body(jobExecutionService.startSetup(request));
  }

  @PostMapping("/crawl")
  public ResponseEntity<StartJobResponse> startCrawl(@RequestBody StartCrawlRequest request) {
    return ResponseEntity.accepted().body(jobExecutionService.startCrawl(request));
  }

  @PostMapping("/extraction")
  public ResponseEntity<StartJobResponse> startExtraction(
      @RequestBody BatchExtractionRequest request) {
    return ResponseEntity.accepted().body(jobExecutionService.startExtraction(request));
  }

  @GetMapping("/jobs/{jobId}")
  public JobSnapshot getStatus(@PathVariable UUID jobId) {
    return jobExecutionService.getStatus(jobId);
  }

  @PostMapping("/jobs/{jobId}/cancel")
  public JobSnapshot cancel(@PathVariable UUID jobId) {
    return jobExecutionService.cancel(jobId);
  }

  @PostMapping("/sitemap/rescan")
  public SitemapRescanResponse rescan(@RequestBody SitemapRescanRequest request) {
    return jobExecutionService.rescan(request.projectId(), request.sitemapUrl());
  }

  @GetMapping("/clients/{clientId}/pages")
  public List<PageSummary> listPages(@PathVariable UUID clientId) {
    return jobExecutionService.listPages(clientId);
  }
}
