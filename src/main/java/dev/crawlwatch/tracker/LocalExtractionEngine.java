package dev.crawlwatch.tracker;

import dev.crawlwatch.engine.JobExecutionService;
import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** In-process engine: calls the {@link JobExecutionService} of this application directly. */
@Component
@ConditionalOnProperty(
    name = "crawlwatch.engine.mode",
    havingValue = "local",
    matchIfMissing = true)
public class LocalExtractionEngine implements ExtractionEngine {

  private final JobExecutionService jobExecutionService;

  public LocalExtractionEngine(JobExecutionService jobExecutionService) {
    this.jobExecutionService = jobExecutionService;
  }

  @Override
  public StartJobResponse startSetup(StartSetupRequest request) {
    return jobExecutionService.startSetup(request);
  }

  @Override
  public StartJobResponse startCrawl(StartCrawlRequest request) {
    return jobExecutionService.startCrawl(request);
  }

  @Override
  public StartJobResponse startExtraction(BatchExtractionRequest request) {
    return jobExecutionService.startExtraction(request);
  }

  @Override
  public JobSnapshot getStatus(UUID jobId) {
    return jobExecutionService.getStatus(jobId);
  }

  @Override
  public JobSnapshot cancel(UUID jobId) {
    return jobExecutionService.cancel(jobId);
  }

  @Override
  public SitemapRescanResponse rescanSitemap(UUID clientId, @Nullable String sitemapUrl) {
    return jobExecutionService.rescan(clientId, sitemapUrl);
  }
}
