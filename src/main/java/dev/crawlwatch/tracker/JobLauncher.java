package dev.crawlwatch.tracker;

import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Starts jobs on the engine and begins polling them. A request the engine rejects throws before
 * any polling starts.
 */
@Service
public class JobLauncher {

  private static final Logger log = LoggerFactory.getLogger(JobLauncher.class);

  private final ExtractionEngine engine;
  private final JobStatusPoller poller;

  public JobLauncher(ExtractionEngine engine, JobStatusPoller poller) {
    this.engine = engine;
    this.poller = poller;
  }

  public LaunchedJob launchSetup(StartSetupRequest request) {
    return track("setup", engine.startSetup(request));
  }

  public LaunchedJob launchCrawl(StartCrawlRequest request) {
    return track("crawl", engine.startCrawl(request));
  }

  public LaunchedJob launchExtraction(BatchExtractionRequest request) {
    return track("extraction", engine.startExtraction(request));
  }

  private LaunchedJob track(String kind, StartJobResponse response) {
    log.info("Launched {} job {} ({})", kind, response.runId(), response.status());
    return new LaunchedJob(response, poller.startPolling(response.runId()));
  }
}
