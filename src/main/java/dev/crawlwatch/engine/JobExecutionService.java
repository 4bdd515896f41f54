package dev.crawlwatch.engine;

import dev.crawlwatch.extraction.BatchExtractionCoordinator;
import dev.crawlwatch.extraction.BatchPlan;
import dev.crawlwatch.extraction.BatchSummary;
import dev.crawlwatch.extraction.ExtractionMethodSelector;
import dev.crawlwatch.extraction.ExtractionProperties;
import dev.crawlwatch.extraction.ExtractionSelection;
import dev.crawlwatch.extraction.PageOutcome;
import dev.crawlwatch.extraction.TestingFailedException;
import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobEvent;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobRequestValidator;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.JobStatus;
import dev.crawlwatch.job.JobType;
import dev.crawlwatch.job.JobValidationException;
import dev.crawlwatch.job.PhaseStateMachine;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import dev.crawlwatch.page.PageRecord;
import dev.crawlwatch.page.PageRecordRepository;
import dev.crawlwatch.page.PageStatus;
import dev.crawlwatch.page.PageSummary;
import dev.crawlwatch.page.UrlNormalizer;
import dev.crawlwatch.sitemap.ClientSitemapRegistry;
import dev.crawlwatch.sitemap.SitemapFetchException;
import dev.crawlwatch.sitemap.SitemapFetcher;
import dev.crawlwatch.sitemap.SitemapRescanResponse;
import dev.crawlwatch.sitemap.SitemapRescanService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Engine-side job runner. Validates start requests, registers the job with the {@link
 * PhaseStateMachine}, and runs it on the job executor, reporting every step as a {@link
 * JobEvent}.
 *
 * <p>Start calls return as soon as the job is registered; callers follow progress through {@link
 * #getStatus(UUID)}. Cancellation only raises a flag; the running job notices it between pages
 * and reports itself cancelled.
 */
@Service
public class JobExecutionService {

  private static final Logger log = LoggerFactory.getLogger(JobExecutionService.class);

  static final String TESTING_FAILED_PREFIX = "Extraction method testing failed: ";
  static final String SITEMAP_ERROR_PREFIX = "Sitemap parsing error: ";
  static final String UNEXPECTED_ERROR_PREFIX = "Unexpected error: ";
  static final String NO_PAGES_MESSAGE = "No pages found for testing";

  private final PhaseStateMachine stateMachine;
  private final JobRequestValidator requestValidator;
  private final SitemapFetcher sitemapFetcher;
  private final ClientSitemapRegistry sitemapRegistry;
  private final SitemapRescanService rescanService;
  private final PageRecordRepository pageRecordRepository;
  private final ExtractionMethodSelector methodSelector;
  private final BatchExtractionCoordinator coordinator;
  private final ExtractionProperties extractionProperties;
  private final Executor jobExecutor;

  public JobExecutionService(
      PhaseStateMachine stateMachine,
      JobRequestValidator requestValidator,
      SitemapFetcher sitemapFetcher,
      ClientSitemapRegistry sitemapRegistry,
      SitemapRescanService rescanService,
      PageRecordRepository pageRecordRepository,
      ExtractionMethodSelector methodSelector,
      BatchExtractionCoordinator coordinator,
      ExtractionProperties extractionProperties,
      @Qualifier("jobTaskExecutor") Executor jobExecutor) {
    this.stateMachine = stateMachine;
    this.requestValidator = requestValidator;
    this.sitemapFetcher = sitemapFetcher;
    this.sitemapRegistry = sitemapRegistry;
    this.rescanService = rescanService;
    this.pageRecordRepository = pageRecordRepository;
    this.methodSelector = methodSelector;
    this.coordinator = coordinator;
    this.extractionProperties = extractionProperties;
    this.jobExecutor = jobExecutor;
  }

  /** Import pages from a sitemap or a manual list. */
  public StartJobResponse startSetup(StartSetupRequest request) {
    requestValidator.validate(request);
    if (request.isSitemapSetup() && !UrlNormalizer.isValidPageUrl(request.sitemapUrl())) {
      throw new JobValidationException(
          "sitemap_url is not a valid http(s) URL: " + request.sitemapUrl());
    }
    int initialTotal = request.isSitemapSetup() ? 0 : request.manualUrls().size();
    UUID jobId = UUID.randomUUID();
    stateMachine.register(jobId, JobType.ENGINE_SETUP, request.clientId(), initialTotal);
    dispatch(jobId, () -> runSetup(jobId, request));
    return new StartJobResponse(
        jobId,
        currentStatus(jobId),
        "Engine setup started (%s)".formatted(request.setupType()));
  }

  /** Discover pages, pick an extraction method on a sample, then extract every page. */
  public StartJobResponse startCrawl(StartCrawlRequest request) {
    requestValidator.validate(request);
    if (request.sitemapUrl() != null
        && !request.sitemapUrl().isBlank()
        && !UrlNormalizer.isValidPageUrl(request.sitemapUrl())) {
      throw new JobValidationException(
          "sitemap_url is not a valid http(s) URL: " + request.sitemapUrl());
    }
    UUID jobId = UUID.randomUUID();
    stateMachine.register(jobId, JobType.CRAWL, request.clientId(), 0);
    dispatch(jobId, () -> runCrawl(jobId, request));
    return new StartJobResponse(jobId, currentStatus(jobId), "Crawl started");
  }

  /** Extract an explicit list of pages with the requested method. */
  public StartJobResponse startExtraction(BatchExtractionRequest request) {
    requestValidator.validate(request);
    if (!coordinator.supports(request.extractionMethod())) {
      throw new JobValidationException(
          "Unknown extraction_method: " + request.extractionMethod());
    }
    List<String> invalid =
        request.urls().stream().filter(url -> !UrlNormalizer.isValidPageUrl(url)).toList();
    if (!invalid.isEmpty()) {
      throw new JobValidationException("Invalid page URLs: " + invalid);
    }
    List<String> urls = normalizeDistinct(request.urls());
    UUID jobId = UUID.randomUUID();
    stateMachine.register(jobId, JobType.EXTRACTION, request.clientId(), urls.size());
    dispatch(jobId, () -> runExtraction(jobId, request, urls));
    return new StartJobResponse(
        jobId,
        currentStatus(jobId),
        "Extraction of %d pages started with %s"
            .formatted(urls.size(), request.extractionMethod()));
  }

  /** @throws JobNotFoundException if the job is unknown */
  public JobSnapshot getStatus(UUID jobId) {
    return stateMachine.getSnapshot(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /**
   * Ask a job to stop. A terminal job is returned unchanged; otherwise the current snapshot is
   * returned and the job reports {@code CANCELLED} once its worker notices.
   */
  public JobSnapshot cancel(UUID jobId) {
    return stateMachine.requestCancel(jobId);
  }

  public SitemapRescanResponse rescan(UUID clientId, @Nullable String sitemapUrl) {
    return rescanService.rescan(clientId, sitemapUrl);
  }

  public List<PageSummary> listPages(UUID clientId) {
    return pageRecordRepository.findAllByClientId(clientId).stream()
        .sorted(Comparator.comparing(PageRecord::getUrl))
        .map(PageSummary::from)
        .toList();
  }

  void runSetup(UUID jobId, StartSetupRequest request) {
    try {
      stateMachine.apply(jobId, new JobEvent.Started());
      if (cancelIfRequested(jobId)) {
        return;
      }
      List<String> candidates;
      if (request.isSitemapSetup()) {
        candidates = sitemapFetcher.fetch(request.sitemapUrl());
        sitemapRegistry.remember(request.clientId(), request.sitemapUrl().trim());
      } else {
        candidates = request.manualUrls();
      }
      stateMachine.apply(jobId, new JobEvent.DiscoveryCompleted(candidates.size()));

      Set<String> seen = new HashSet<>();
      for (String candidate : candidates) {
        if (cancelIfRequested(jobId)) {
          return;
        }
        stateMachine.apply(
            jobId, new JobEvent.PageClassified(importPage(request.clientId(), candidate, seen)));
      }
      stateMachine.apply(jobId, new JobEvent.Completed());
    } catch (SitemapFetchException e) {
      log.warn("Setup job {} could not read sitemap: {}", jobId, e.getMessage());
      stateMachine.apply(jobId, new JobEvent.Failed(SITEMAP_ERROR_PREFIX + e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Setup job {} failed: {}", jobId, e.getMessage(), e);
      stateMachine.apply(jobId, new JobEvent.Failed(UNEXPECTED_ERROR_PREFIX + e.getMessage()));
    }
  }

  void runCrawl(UUID jobId, StartCrawlRequest request) {
    UUID clientId = request.clientId();
    try {
      stateMachine.apply(jobId, new JobEvent.Started());
      if (cancelIfRequested(jobId)) {
        return;
      }
      List<String> urls = discover(clientId, request.sitemapUrl());
      if (urls.isEmpty()) {
        stateMachine.apply(jobId, new JobEvent.Failed(NO_PAGES_MESSAGE));
        return;
      }
      stateMachine.apply(jobId, new JobEvent.DiscoveryCompleted(urls.size()));
      if (cancelIfRequested(jobId)) {
        return;
      }

      ExtractionSelection selection = selectMethod(clientId, urls);
      stateMachine.apply(jobId, new JobEvent.TestingCompleted(selection));
      if (cancelIfRequested(jobId)) {
        return;
      }

      BatchSummary summary =
          coordinator.extract(
              new BatchPlan(clientId, urls, selection.winningMethod(), false),
              () -> stateMachine.isCancelRequested(jobId),
              outcome -> report(jobId, outcome));
      finish(jobId, summary);
    } catch (TestingFailedException e) {
      log.warn("Crawl job {} failed during method testing: {}", jobId, e.getMessage());
      stateMachine.apply(jobId, new JobEvent.Failed(TESTING_FAILED_PREFIX + e.getMessage()));
    } catch (SitemapFetchException e) {
      log.warn("Crawl job {} could not read sitemap: {}", jobId, e.getMessage());
      stateMachine.apply(jobId, new JobEvent.Failed(SITEMAP_ERROR_PREFIX + e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Crawl job {} failed: {}", jobId, e.getMessage(), e);
      stateMachine.apply(jobId, new JobEvent.Failed(UNEXPECTED_ERROR_PREFIX + e.getMessage()));
    }
  }

  void runExtraction(UUID jobId, BatchExtractionRequest request, List<String> urls) {
    try {
      stateMachine.apply(jobId, new JobEvent.Started());
      if (cancelIfRequested(jobId)) {
        return;
      }
      BatchSummary summary =
          coordinator.extract(
              new BatchPlan(request.clientId(), urls, request.extractionMethod(), request.force()),
              () -> stateMachine.isCancelRequested(jobId),
              outcome -> report(jobId, outcome));
      finish(jobId, summary);
    } catch (RuntimeException e) {
      log.error("Extraction job {} failed: {}", jobId, e.getMessage(), e);
      stateMachine.apply(jobId, new JobEvent.Failed(UNEXPECTED_ERROR_PREFIX + e.getMessage()));
    }
  }

  private PageOutcome importPage(UUID clientId, String candidate, Set<String> seen) {
    if (!UrlNormalizer.isValidPageUrl(candidate)) {
      return PageOutcome.failed(String.valueOf(candidate), "Invalid URL");
    }
    String url = UrlNormalizer.normalize(candidate);
    if (!seen.add(url)) {
      return PageOutcome.skipped(url);
    }
    if (pageRecordRepository.findByClientIdAndUrl(clientId, url).isPresent()) {
      return PageOutcome.skipped(url);
    }
    pageRecordRepository.save(new PageRecord(clientId, url));
    return PageOutcome.success(url, true);
  }

  /**
   * URLs to crawl: the sitemap's pages when a sitemap is given (missing page records are created
   * on the way), otherwise every page of the client still listed in its sitemap.
   */
  private List<String> discover(UUID clientId, @Nullable String sitemapUrl) {
    Map<String, PageRecord> known =
        pageRecordRepository.findAllByClientId(clientId).stream()
            .collect(Collectors.toMap(PageRecord::getUrl, Function.identity(), (a, b) -> a));
    if (sitemapUrl == null || sitemapUrl.isBlank()) {
      return known.values().stream()
          .filter(PageRecord::isInSitemap)
          .map(PageRecord::getUrl)
          .sorted()
          .toList();
    }

    List<String> urls =
        normalizeDistinct(
            sitemapFetcher.fetch(sitemapUrl).stream()
                .filter(UrlNormalizer::isValidPageUrl)
                .toList());
    sitemapRegistry.remember(clientId, sitemapUrl.trim());
    for (String url : urls) {
      if (!known.containsKey(url)) {
        pageRecordRepository.save(new PageRecord(clientId, url));
      }
    }
    log.info("Discovered {} pages for client {} from {}", urls.size(), clientId, sitemapUrl);
    return urls;
  }

  /** Marks the sample pages as under test while the selector runs. */
  private ExtractionSelection selectMethod(UUID clientId, List<String> urls) {
    List<String> sample = urls.stream().limit(extractionProperties.getSampleSize()).toList();
    List<PageRecord> testing = new ArrayList<>();
    for (PageRecord page : pageRecordRepository.findAllByClientIdAndUrlIn(clientId, sample)) {
      if (page.getStatus() == PageStatus.DISCOVERED) {
        page.setStatus(PageStatus.TESTING);
        testing.add(pageRecordRepository.save(page));
      }
    }
    try {
      return methodSelector.select(urls);
    } finally {
      for (PageRecord page : testing) {
        if (page.getStatus() == PageStatus.TESTING) {
          page.setStatus(PageStatus.DISCOVERED);
          pageRecordRepository.save(page);
        }
      }
    }
  }

  private void report(UUID jobId, PageOutcome outcome) {
    stateMachine.apply(jobId, new JobEvent.PageClassified(outcome));
  }

  private void finish(UUID jobId, BatchSummary summary) {
    if (summary.cancelled()) {
      stateMachine.apply(jobId, new JobEvent.Cancelled());
    } else {
      stateMachine.apply(jobId, new JobEvent.Completed());
    }
  }

  private boolean cancelIfRequested(UUID jobId) {
    if (stateMachine.isCancelRequested(jobId)) {
      stateMachine.apply(jobId, new JobEvent.Cancelled());
      return true;
    }
    return false;
  }

  private void dispatch(UUID jobId, Runnable job) {
    try {
      jobExecutor.execute(job);
    } catch (RejectedExecutionException e) {
      log.error("Could not schedule job {}: {}", jobId, e.getMessage());
      stateMachine.apply(jobId, new JobEvent.Failed("Engine is busy, job could not be scheduled"));
    }
  }

  private JobStatus currentStatus(UUID jobId) {
    return getStatus(jobId).status();
  }

  private static List<String> normalizeDistinct(List<String> urls) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String url : urls) {
      normalized.add(UrlNormalizer.normalize(url));
    }
    return List.copyOf(normalized);
  }
}
