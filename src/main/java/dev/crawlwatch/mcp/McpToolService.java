package dev.crawlwatch.mcp;

import dev.crawlwatch.extraction.ExtractionTrialResult;
import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import dev.crawlwatch.tracker.CancellationHandler;
import dev.crawlwatch.tracker.ExtractionEngine;
import dev.crawlwatch.tracker.JobLauncher;
import dev.crawlwatch.tracker.ProgressObserverBridge;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing job control as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code start_engine_setup}, {@code start_crawl}, {@code extract_pages}, {@code
 * job_status}, {@code cancel_job}, {@code rescan_sitemap}.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private static final int MAX_LISTED_URLS = 20;

  private final JobLauncher launcher;
  private final CancellationHandler cancellationHandler;
  private final ProgressObserverBridge bridge;
  private final ExtractionEngine engine;

  public McpToolService(
      JobLauncher launcher,
      CancellationHandler cancellationHandler,
      ProgressObserverBridge bridge,
      ExtractionEngine engine) {
    this.launcher = launcher;
    this.cancellationHandler = cancellationHandler;
    this.bridge = bridge;
    this.engine = engine;
  }

  /** Imports a client's pages from a sitemap or a manual URL list. */
  @Tool(
      name = "start_engine_setup",
      description =
          "Import the pages of a client site, either from a sitemap URL or from a manual list of "
              + "page URLs. Returns the job ID; check progress with job_status.")
  public String startEngineSetup(
      @ToolParam(description = "UUID of the client") String clientId,
      @ToolParam(description = "Setup type: 'sitemap' or 'manual'") String setupType,
      @ToolParam(description = "Sitemap URL, required for sitemap setup", required = false)
          @Nullable String sitemapUrl,
      @ToolParam(
              description = "Comma-separated page URLs, required for manual setup",
              required = false)
          @Nullable String manualUrls) {
    try {
      StartJobResponse response =
          launcher
              .launchSetup(
                  new StartSetupRequest(
                      parseUuid(clientId),
                      setupType == null ? null : setupType.trim().toLowerCase(),
                      sitemapUrl,
                      parseCommaSeparated(manualUrls)))
              .response();
      return formatStarted(response);
    } catch (Exception e) {
      return "Error starting engine setup: " + e.getMessage();
    }
  }

  /** Crawls a client site: discovery, extraction method testing, then extraction. */
  @Tool(
      name = "start_crawl",
      description =
          "Crawl a client site: discover pages (from the sitemap if given, else the known pages), "
              + "test extraction methods on a sample, then extract every page with the best one.")
  public String startCrawl(
      @ToolParam(description = "UUID of the client") String clientId,
      @ToolParam(description = "Sitemap URL to discover pages from", required = false)
          @Nullable String sitemapUrl) {
    try {
      StartJobResponse response =
          launcher.launchCrawl(new StartCrawlRequest(parseUuid(clientId), sitemapUrl)).response();
      return formatStarted(response);
    } catch (Exception e) {
      return "Error starting crawl: " + e.getMessage();
    }
  }

  /** Extracts an explicit list of pages with a given method. */
  @Tool(
      name = "extract_pages",
      description =
          "Extract the given pages with an extraction method (crawl4ai or jina). Pages extracted "
              + "with the same method in the last 24 hours are skipped unless force is true.")
  public String extractPages(
      @ToolParam(description = "UUID of the client") String clientId,
      @ToolParam(description = "Comma-separated page URLs") @Nullable String urls,
      @ToolParam(description = "Extraction method, e.g. 'crawl4ai' or 'jina'") String method,
      @ToolParam(description = "Re-extract fresh pages too (default false)", required = false)
          @Nullable Boolean force) {
    try {
      List<String> pageUrls = parseCommaSeparated(urls);
      if (pageUrls.isEmpty()) {
        return "Error: No URLs given. Provide a comma-separated list of page URLs.";
      }
      StartJobResponse response =
          launcher
              .launchExtraction(
                  new BatchExtractionRequest(
                      parseUuid(clientId), pageUrls, method, Boolean.TRUE.equals(force)))
              .response();
      return formatStarted(response);
    } catch (Exception e) {
      return "Error starting extraction: " + e.getMessage();
    }
  }

  /** Reports the latest known state of a job. */
  @Tool(
      name = "job_status",
      description = "Check the phase, status, progress and counters of a job by ID.")
  public String jobStatus(@ToolParam(description = "UUID of the job") String jobId) {
    try {
      UUID uuid = parseUuid(jobId);
      JobSnapshot snapshot = bridge.lastDelivered(uuid).orElseGet(() -> engine.getStatus(uuid));
      return formatSnapshot(snapshot);
    } catch (JobNotFoundException e) {
      return "Error: Job %s not found.".formatted(jobId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid job ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error checking job status: " + e.getMessage();
    }
  }

  /** Requests cancellation; the job stops between pages. */
  @Tool(
      name = "cancel_job",
      description =
          "Request cancellation of a running job. The job stops after the pages in progress; "
              + "check job_status for the final CANCELLED status.")
  public String cancelJob(@ToolParam(description = "UUID of the job") String jobId) {
    try {
      JobSnapshot snapshot = cancellationHandler.cancel(parseUuid(jobId));
      if (snapshot.isTerminal()) {
        return "Job %s already finished (%s).".formatted(snapshot.id(), snapshot.status());
      }
      return "Cancellation requested for job %s (currently %s, %d%%)."
          .formatted(snapshot.id(), snapshot.status(), snapshot.progressPercentage());
    } catch (JobNotFoundException e) {
      return "Error: Job %s not found.".formatted(jobId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid job ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error cancelling job: " + e.getMessage();
    }
  }

  /** Re-reads the sitemap and records new and removed pages. */
  @Tool(
      name = "rescan_sitemap",
      description =
          "Re-read a client's sitemap and report new and removed pages. Removed pages are kept "
              + "and flagged, never deleted.")
  public String rescanSitemap(
      @ToolParam(description = "UUID of the client") String clientId,
      @ToolParam(
              description = "Sitemap URL; defaults to the last one used for this client",
              required = false)
          @Nullable String sitemapUrl) {
    try {
      SitemapRescanResponse response = engine.rescanSitemap(parseUuid(clientId), sitemapUrl);
      StringBuilder sb = new StringBuilder();
      sb.append(response.message()).append(String.format("%n"));
      sb.append(
          String.format(
              "Total in sitemap: %d | new: %d | removed: %d | unchanged: %d%n",
              response.totalInSitemap(),
              response.newCount(),
              response.removedCount(),
              response.unchangedCount()));
      appendUrls(sb, "New pages", response.newUrls());
      appendUrls(sb, "Removed pages", response.removedUrls());
      return sb.toString();
    } catch (Exception e) {
      log.debug("Sitemap rescan failed for client {}: {}", clientId, e.getMessage());
      return "Error rescanning sitemap: " + e.getMessage();
    }
  }

  private static String formatStarted(StartJobResponse response) {
    return "%s (job ID: %s, status: %s). Check progress with job_status."
        .formatted(response.message(), response.runId(), response.status());
  }

  private static String formatSnapshot(JobSnapshot snapshot) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Job: %s (%s)%n", snapshot.id(), snapshot.jobType()));
    sb.append(
        String.format(
            "Status: %s | phase: %s | progress: %d%%%n",
            snapshot.status(), snapshot.phase(), snapshot.progressPercentage()));
    sb.append(
        String.format(
            "Pages: %d/%d processed, %d successful, %d failed, %d skipped%n",
            snapshot.processed(),
            snapshot.total(),
            snapshot.successful(),
            snapshot.failed(),
            snapshot.skipped()));
    if (snapshot.currentUrl() != null) {
      sb.append(String.format("Current page: %s%n", snapshot.currentUrl()));
    }
    if (snapshot.winningMethod() != null) {
      sb.append(String.format("Extraction method: %s%n", snapshot.winningMethod()));
      for (ExtractionTrialResult trial : snapshot.trialResults()) {
        sb.append(
            String.format(
                "  - %s: score %.2f, %d/%d pages%n",
                trial.methodName(), trial.score(), trial.successes(), trial.attempts()));
      }
    }
    if (snapshot.errorMessage() != null) {
      sb.append(String.format("Error: %s%n", snapshot.errorMessage()));
    }
    return sb.toString();
  }

  private static void appendUrls(StringBuilder sb, String title, List<String> urls) {
    if (urls.isEmpty()) {
      return;
    }
    sb.append(String.format("%s:%n", title));
    urls.stream().limit(MAX_LISTED_URLS).forEach(url -> sb.append(String.format("  - %s%n", url)));
    if (urls.size() > MAX_LISTED_URLS) {
      sb.append(String.format("  ... and %d more%n", urls.size() - MAX_LISTED_URLS));
    }
  }

  private static UUID parseUuid(String value) {
    return UUID.fromString(value == null ? "" : value.trim());
  }

  private static List<String> parseCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
