package dev.crawlwatch.engine;

import static dev.crawlwatch.fixture.StubExtractionStrategy.PLAIN_TEXT;
import static dev.crawlwatch.fixture.StubExtractionStrategy.RICH_MARKDOWN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.crawlwatch.extraction.BatchExtractionCoordinator;
import dev.crawlwatch.extraction.ExtractionMethodSelector;
import dev.crawlwatch.extraction.ExtractionProperties;
import dev.crawlwatch.extraction.ExtractionResult;
import dev.crawlwatch.extraction.ExtractionStrategy;
import dev.crawlwatch.fixture.InMemoryClientSitemaps;
import dev.crawlwatch.fixture.PageRecordBuilder;
import dev.crawlwatch.fixture.StubExtractionStrategy;
import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobPhase;
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
import dev.crawlwatch.sitemap.ClientSitemapRegistry;
import dev.crawlwatch.sitemap.SitemapFetchException;
import dev.crawlwatch.sitemap.SitemapFetcher;
import dev.crawlwatch.sitemap.SitemapRescanService;
import jakarta.validation.Validation;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobExecutionServiceTest {

  private static final UUID CLIENT_ID = UUID.randomUUID();
  private static final String SITEMAP_URL = "https://acme.example/sitemap.xml";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private SitemapFetcher sitemapFetcher;

  @Mock private SitemapRescanService rescanService;

  @Mock private PageRecordRepository pageRecordRepository;

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private final List<Runnable> queuedJobs = new ArrayList<>();
  private PhaseStateMachine stateMachine;
  private ClientSitemapRegistry sitemapRegistry;
  private ExtractionProperties extractionProperties;

  @BeforeEach
  void setUp() {
    stateMachine = new PhaseStateMachine(clock);
    sitemapRegistry = new ClientSitemapRegistry(InMemoryClientSitemaps.repository());
    extractionProperties = new ExtractionProperties();
    extractionProperties.setSampleSize(2);
  }

  /** Service whose jobs wait in {@link #queuedJobs} until the test runs them. */
  private JobExecutionService service(ExtractionStrategy... strategies) {
    return service(queuedJobs::add, strategies);
  }

  private JobExecutionService service(Executor jobExecutor, ExtractionStrategy... strategies) {
    Executor direct = Runnable::run;
    List<ExtractionStrategy> strategyList = List.of(strategies);
    return new JobExecutionService(
        stateMachine,
        new JobRequestValidator(Validation.buildDefaultValidatorFactory().getValidator()),
        sitemapFetcher,
        sitemapRegistry,
        rescanService,
        pageRecordRepository,
        new ExtractionMethodSelector(strategyList, extractionProperties, direct),
        new BatchExtractionCoordinator(
            strategyList, pageRecordRepository, extractionProperties, direct, clock),
        extractionProperties,
        jobExecutor);
  }

  private void runQueuedJobs() {
    List<Runnable> jobs = List.copyOf(queuedJobs);
    queuedJobs.clear();
    jobs.forEach(Runnable::run);
  }

  private void stubUnknownPages() {
    lenient()
        .when(pageRecordRepository.findByClientIdAndUrl(eq(CLIENT_ID), anyString()))
        .thenReturn(Optional.empty());
    lenient()
        .when(pageRecordRepository.save(any(PageRecord.class)))
        .thenAnswer(inv -> inv.getArgument(0));
  }

  private static List<String> urls(int count) {
    List<String> urls = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      urls.add("https://acme.example/page-" + i);
    }
    return urls;
  }

  // ---------------------------------------------------------------------------
  // Setup jobs
  // ---------------------------------------------------------------------------

  @Test
  void startSetupRegistersPendingJobAndReturnsImmediately() {
    StartJobResponse response =
        service()
            .startSetup(
                new StartSetupRequest(
                    CLIENT_ID, "manual", null, List.of("https://acme.example/a")));

    assertThat(response.status()).isEqualTo(JobStatus.PENDING);
    JobSnapshot snapshot = stateMachine.getSnapshot(response.runId()).orElseThrow();
    assertThat(snapshot.jobType()).isEqualTo(JobType.ENGINE_SETUP);
    assertThat(snapshot.total()).isEqualTo(1);
    assertThat(queuedJobs).hasSize(1);
  }

  @Test
  void manualSetupImportsNewUrlsAndSkipsKnownOrDuplicateOnes() {
    stubUnknownPages();
    when(pageRecordRepository.findByClientIdAndUrl(CLIENT_ID, "https://acme.example/known"))
        .thenReturn(Optional.of(new PageRecordBuilder().clientId(CLIENT_ID).build()));
    JobExecutionService service = service();
    StartJobResponse response =
        service.startSetup(
            new StartSetupRequest(
                CLIENT_ID,
                "manual",
                null,
                List.of(
                    "https://acme.example/a",
                    "https://acme.example/a/",
                    "https://acme.example/known",
                    "not a url")));

    runQueuedJobs();

    JobSnapshot done = service.getStatus(response.runId());
    assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.successful()).isEqualTo(1);
    assertThat(done.skipped()).isEqualTo(2);
    assertThat(done.failed()).isEqualTo(1);
    assertThat(done.total()).isEqualTo(4);
    assertThat(done.progressPercentage()).isEqualTo(100);
  }

  @Test
  void sitemapSetupRemembersSitemapForLaterRescans() {
    stubUnknownPages();
    when(sitemapFetcher.fetch(SITEMAP_URL)).thenReturn(urls(3));
    JobExecutionService service = service();
    StartJobResponse response =
        service.startSetup(new StartSetupRequest(CLIENT_ID, "sitemap", SITEMAP_URL, null));

    runQueuedJobs();

    assertThat(service.getStatus(response.runId()).successful()).isEqualTo(3);
    assertThat(sitemapRegistry.lookup(CLIENT_ID)).contains(SITEMAP_URL);
  }

  @Test
  void unreadableSitemapFailsSetupWithSitemapError() {
    when(sitemapFetcher.fetch(SITEMAP_URL))
        .thenThrow(new SitemapFetchException("Could not parse sitemap"));
    JobExecutionService service = service();
    StartJobResponse response =
        service.startSetup(new StartSetupRequest(CLIENT_ID, "sitemap", SITEMAP_URL, null));

    runQueuedJobs();

    JobSnapshot failed = service.getStatus(response.runId());
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("Sitemap parsing error: Could not parse sitemap");
  }

  @Test
  void invalidSetupIsRejectedBeforeRegistration() {
    JobExecutionService service = service();

    assertThatThrownBy(
            () ->
                service.startSetup(
                    new StartSetupRequest(CLIENT_ID, "sitemap", "ftp://acme.example/s.xml", null)))
        .isInstanceOf(JobValidationException.class);
    assertThat(queuedJobs).isEmpty();
  }

  // ---------------------------------------------------------------------------
  // Crawl jobs
  // ---------------------------------------------------------------------------

  @Test
  void crawlDiscoversTestsAndExtractsWithTheWinningMethod() {
    stubUnknownPages();
    when(sitemapFetcher.fetch(SITEMAP_URL)).thenReturn(urls(4));
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);
    var jina = StubExtractionStrategy.returning("jina", PLAIN_TEXT);
    JobExecutionService service = service(crawl4ai, jina);
    StartJobResponse response = service.startCrawl(new StartCrawlRequest(CLIENT_ID, SITEMAP_URL));

    runQueuedJobs();

    JobSnapshot done = service.getStatus(response.runId());
    assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.phase()).isEqualTo(JobPhase.COMPLETED);
    assertThat(done.winningMethod()).isEqualTo("crawl4ai");
    assertThat(done.trialResults()).hasSize(2);
    assertThat(done.total()).isEqualTo(4);
    assertThat(done.successful()).isEqualTo(4);
    assertThat(done.progressPercentage()).isEqualTo(100);
    // 2 sample pages during testing, then all 4 pages
    assertThat(crawl4ai.calls()).hasSize(6);
    assertThat(jina.calls()).hasSize(2);
  }

  @Test
  void crawlWithoutSitemapUsesPagesStillInSitemap() {
    stubUnknownPages();
    PageRecord listed =
        new PageRecordBuilder().clientId(CLIENT_ID).url("https://acme.example/listed").build();
    PageRecord dropped =
        new PageRecordBuilder()
            .clientId(CLIENT_ID)
            .url("https://acme.example/dropped")
            .inSitemap(false)
            .build();
    when(pageRecordRepository.findAllByClientId(CLIENT_ID)).thenReturn(List.of(listed, dropped));
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);
    JobExecutionService service = service(crawl4ai);
    StartJobResponse response = service.startCrawl(new StartCrawlRequest(CLIENT_ID, null));

    runQueuedJobs();

    assertThat(service.getStatus(response.runId()).total()).isEqualTo(1);
    assertThat(crawl4ai.calls()).containsOnly("https://acme.example/listed");
    verify(sitemapFetcher, never()).fetch(anyString());
  }

  @Test
  void crawlWithNoPagesFails() {
    when(pageRecordRepository.findAllByClientId(CLIENT_ID)).thenReturn(List.of());
    JobExecutionService service = service(StubExtractionStrategy.returning("crawl4ai", "x"));
    StartJobResponse response = service.startCrawl(new StartCrawlRequest(CLIENT_ID, null));

    runQueuedJobs();

    JobSnapshot failed = service.getStatus(response.runId());
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("No pages found for testing");
  }

  @Test
  void crawlFailsWhenEveryMethodFailsTesting() {
    stubUnknownPages();
    when(sitemapFetcher.fetch(SITEMAP_URL)).thenReturn(urls(3));
    JobExecutionService service =
        service(
            StubExtractionStrategy.failing("crawl4ai", "Connection refused", null),
            StubExtractionStrategy.failing("jina", null, 403));
    StartJobResponse response = service.startCrawl(new StartCrawlRequest(CLIENT_ID, SITEMAP_URL));

    runQueuedJobs();

    JobSnapshot failed = service.getStatus(response.runId());
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.phase()).isEqualTo(JobPhase.FAILED);
    assertThat(failed.errorMessage())
        .isEqualTo(
            "Extraction method testing failed: "
                + "All extraction methods failed on all 2 sample pages");
  }

  @Test
  void samplePagesAreMarkedTestingAndResetAfterSelection() {
    stubUnknownPages();
    PageRecord first =
        new PageRecordBuilder().clientId(CLIENT_ID).url("https://acme.example/page-1").build();
    when(sitemapFetcher.fetch(SITEMAP_URL)).thenReturn(urls(1));
    when(pageRecordRepository.findAllByClientIdAndUrlIn(eq(CLIENT_ID), anyCollection()))
        .thenReturn(List.of(first));
    List<PageStatus> statusDuringTrial = new ArrayList<>();
    var strategy =
        new StubExtractionStrategy(
            "crawl4ai",
            url -> {
              statusDuringTrial.add(first.getStatus());
              return ExtractionResult.failure(url, "Not Found", 404);
            });
    JobExecutionService service = service(strategy);
    service.startCrawl(new StartCrawlRequest(CLIENT_ID, SITEMAP_URL));

    runQueuedJobs();

    assertThat(statusDuringTrial).containsExactly(PageStatus.TESTING);
    assertThat(first.getStatus()).isEqualTo(PageStatus.DISCOVERED);
  }

  @Test
  void cancelBeforeWorkerStartsEndsCancelled() {
    JobExecutionService service = service(StubExtractionStrategy.returning("crawl4ai", "x"));
    StartJobResponse response = service.startCrawl(new StartCrawlRequest(CLIENT_ID, SITEMAP_URL));

    JobSnapshot afterCancel = service.cancel(response.runId());
    assertThat(afterCancel.status()).isEqualTo(JobStatus.PENDING);

    runQueuedJobs();

    assertThat(service.getStatus(response.runId()).status()).isEqualTo(JobStatus.CANCELLED);
    verify(sitemapFetcher, never()).fetch(anyString());
  }

  @Test
  void cancelDuringExtractionKeepsCountersOfFinishedPages() {
    stubUnknownPages();
    AtomicReference<Runnable> cancelJob = new AtomicReference<>(() -> {});
    var strategy =
        new StubExtractionStrategy(
            "crawl4ai",
            url -> {
              if (url.endsWith("page-2")) {
                cancelJob.get().run();
              }
              return ExtractionResult.success(url, RICH_MARKDOWN);
            });
    JobExecutionService service = service(strategy);
    StartJobResponse response =
        service.startExtraction(
            new BatchExtractionRequest(CLIENT_ID, urls(5), "crawl4ai", false));
    cancelJob.set(() -> service.cancel(response.runId()));

    runQueuedJobs();

    JobSnapshot cancelled = service.getStatus(response.runId());
    assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(cancelled.successful()).isEqualTo(2);
    assertThat(cancelled.total()).isEqualTo(5);
    assertThat(strategy.calls()).hasSize(2);
  }

  // ---------------------------------------------------------------------------
  // Extraction jobs
  // ---------------------------------------------------------------------------

  @Test
  void extractionNormalizesAndDeduplicatesUrls() {
    stubUnknownPages();
    var jina = StubExtractionStrategy.returning("jina", "# Page");
    JobExecutionService service = service(jina);
    StartJobResponse response =
        service.startExtraction(
            new BatchExtractionRequest(
                CLIENT_ID,
                List.of("https://acme.example/a/", "https://acme.example/a#x"),
                "jina",
                false));

    runQueuedJobs();

    JobSnapshot done = service.getStatus(response.runId());
    assertThat(done.total()).isEqualTo(1);
    assertThat(done.successful()).isEqualTo(1);
    assertThat(jina.calls()).containsExactly("https://acme.example/a");
  }

  @Test
  void extractionWithUnknownMethodIsRejected() {
    JobExecutionService service = service(StubExtractionStrategy.returning("jina", "x"));

    assertThatThrownBy(
            () ->
                service.startExtraction(
                    new BatchExtractionRequest(
                        CLIENT_ID, List.of("https://acme.example/a"), "playwright", false)))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("playwright");
  }

  @Test
  void extractionWithInvalidUrlsIsRejected() {
    JobExecutionService service = service(StubExtractionStrategy.returning("jina", "x"));

    assertThatThrownBy(
            () ->
                service.startExtraction(
                    new BatchExtractionRequest(CLIENT_ID, List.of("/relative"), "jina", false)))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("/relative");
  }

  @Test
  void rejectedDispatchFailsTheJob() {
    Executor busy =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    JobExecutionService service = service(busy, StubExtractionStrategy.returning("jina", "x"));

    StartJobResponse response =
        service.startExtraction(
            new BatchExtractionRequest(
                CLIENT_ID, List.of("https://acme.example/a"), "jina", false));

    assertThat(response.status()).isEqualTo(JobStatus.FAILED);
    assertThat(service.getStatus(response.runId()).errorMessage())
        .isEqualTo("Engine is busy, job could not be scheduled");
  }

  // ---------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------

  @Test
  void unknownJobStatusThrowsNotFound() {
    assertThatThrownBy(() -> service().getStatus(UUID.randomUUID()))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void listPagesIsSortedByUrl() {
    when(pageRecordRepository.findAllByClientId(CLIENT_ID))
        .thenReturn(
            List.of(
                new PageRecordBuilder().clientId(CLIENT_ID).url("https://acme.example/b").build(),
                new PageRecordBuilder().clientId(CLIENT_ID).url("https://acme.example/a").build()));

    List<PageSummary> pages = service().listPages(CLIENT_ID);

    assertThat(pages)
        .extracting(PageSummary::url)
        .containsExactly("https://acme.example/a", "https://acme.example/b");
  }
}
