package dev.crawlwatch.tracker;

import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.EngineUnavailableException;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.JobValidationException;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * The tracker's view of the engine. The engine owns job records; the tracker only starts,
 * cancels and reads them.
 *
 * <p>Every method may throw {@link EngineUnavailableException} for transient failures, {@link
 * JobValidationException} for rejected requests and {@link JobNotFoundException} for unknown job
 * ids.
 *
 * @see LocalExtractionEngine
 * @see RemoteExtractionEngine
 */
public interface ExtractionEngine {

  StartJobResponse startSetup(StartSetupRequest request);

  StartJobResponse startCrawl(StartCrawlRequest request);

  StartJobResponse startExtraction(BatchExtractionRequest request);

  JobSnapshot getStatus(UUID jobId);

  /**
   * Ask the engine to cancel a job. Returns the terminal snapshot unchanged for a finished job;
   * otherwise the current (still running) snapshot.
   */
  JobSnapshot cancel(UUID jobId);

  SitemapRescanResponse rescanSitemap(UUID clientId, @Nullable String sitemapUrl);
}
