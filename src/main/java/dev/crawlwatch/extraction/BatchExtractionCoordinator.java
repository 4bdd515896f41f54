package dev.crawlwatch.extraction;

import dev.crawlwatch.page.ContentHasher;
import dev.crawlwatch.page.PageRecord;
import dev.crawlwatch.page.PageRecordRepository;
import dev.crawlwatch.page.PageStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Extracts a batch of pages with one strategy, at most {@code crawlwatch.extraction.concurrency}
 * pages at a time.
 *
 * <p>Every URL ends up as exactly one {@link PageOutcome}, reported to the caller as soon as it is
 * known. A page that was crawled with the same method within the freshness window is skipped
 * without any network call unless the plan forces re-extraction. A failing page never stops the
 * batch.
 *
 * <p>Cancellation is cooperative: once {@code cancelRequested} answers true no further unit is
 * dispatched, but units already running finish and are classified.
 */
@Service
public class BatchExtractionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(BatchExtractionCoordinator.class);

  private final Map<String, ExtractionStrategy> strategies;
  private final PageRecordRepository pageRecordRepository;
  private final ExtractionProperties properties;
  private final Executor executor;
  private final Clock clock;

  public BatchExtractionCoordinator(
      List<ExtractionStrategy> strategies,
      PageRecordRepository pageRecordRepository,
      ExtractionProperties properties,
      @Qualifier("extractionTaskExecutor") Executor executor,
      Clock clock) {
    this.strategies =
        strategies.stream()
            .collect(Collectors.toUnmodifiableMap(ExtractionStrategy::name, Function.identity()));
    this.pageRecordRepository = pageRecordRepository;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
  }

  /** Whether a strategy with this name is registered. */
  public boolean supports(String method) {
    return strategies.containsKey(method);
  }

  /**
   * Runs the batch and blocks until every dispatched unit has been classified.
   *
   * @param plan pages and method
   * @param cancelRequested polled before each dispatch
   * @param onClassified receives each outcome, possibly from several threads at once
   * @return counters of the batch
   * @throws IllegalArgumentException if the plan names an unknown method
   */
  public BatchSummary extract(
      BatchPlan plan, BooleanSupplier cancelRequested, Consumer<PageOutcome> onClassified) {
    ExtractionStrategy strategy = strategies.get(plan.method());
    if (strategy == null) {
      throw new IllegalArgumentException("Unknown extraction method: " + plan.method());
    }

    Semaphore permits = new Semaphore(properties.getConcurrency());
    AtomicInteger successful = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();
    List<CompletableFuture<Void>> inFlight = new ArrayList<>();
    boolean cancelled = false;

    log.info(
        "Extracting {} pages for client {} with {} (force={})",
        plan.urls().size(),
        plan.clientId(),
        strategy.name(),
        plan.force());

    for (String url : plan.urls()) {
      if (cancelRequested.getAsBoolean()) {
        cancelled = true;
        break;
      }
      try {
        permits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelled = true;
        break;
      }
      if (cancelRequested.getAsBoolean()) {
        permits.release();
        cancelled = true;
        break;
      }
      CompletableFuture<Void> unit =
          CompletableFuture.runAsync(
              () -> {
                try {
                  PageOutcome outcome = runUnit(plan, strategy, url);
                  count(outcome, successful, failed, skipped);
                  notify(onClassified, outcome);
                } finally {
                  permits.release();
                }
              },
              executor);
      inFlight.add(unit);
    }

    CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0])).join();

    BatchSummary summary =
        new BatchSummary(
            plan.urls().size(), successful.get(), failed.get(), skipped.get(), cancelled);
    log.info(
        "Batch for client {} finished: {} successful, {} failed, {} skipped{}",
        plan.clientId(),
        summary.successful(),
        summary.failed(),
        summary.skipped(),
        cancelled ? " (cancelled)" : "");
    return summary;
  }

  private PageOutcome runUnit(BatchPlan plan, ExtractionStrategy strategy, String url) {
    try {
      UUID clientId = plan.clientId();
      PageRecord page =
          pageRecordRepository
              .findByClientIdAndUrl(clientId, url)
              .orElseGet(() -> new PageRecord(clientId, url));

      Duration window = properties.getFreshnessWindow();
      if (!plan.force() && page.isFreshFor(strategy.name(), clock.instant(), window)) {
        log.debug("Skipping fresh page {}", url);
        return PageOutcome.skipped(url);
      }

      page.setStatus(PageStatus.CRAWLING);
      page = pageRecordRepository.save(page);

      ExtractionResult result;
      try {
        result = strategy.extract(url);
      } catch (RuntimeException e) {
        ClassifiedError error = CrawlErrorClassifier.classify(e);
        log.warn("Extraction of {} threw ({}): {}", url, error.category(), e.getMessage());
        page.recordFailure(error.message());
        pageRecordRepository.save(page);
        return PageOutcome.failed(url, error.message());
      }

      if (result != null && result.hasContent()) {
        String markdown = result.markdown();
        boolean changed =
            page.recordExtraction(
                strategy.name(), markdown, ContentHasher.sha256(markdown), clock.instant());
        pageRecordRepository.save(page);
        return PageOutcome.success(url, changed);
      }

      ClassifiedError error =
          result == null
              ? CrawlErrorClassifier.classify("No result", null)
              : CrawlErrorClassifier.classify(result.errorMessage(), result.statusCode());
      log.warn("Extraction of {} failed ({}): {}", url, error.category(), error.message());
      page.recordFailure(error.message());
      pageRecordRepository.save(page);
      return PageOutcome.failed(url, error.message());
    } catch (RuntimeException e) {
      ClassifiedError error = CrawlErrorClassifier.classify(e);
      log.warn("Could not process page {}: {}", url, e.getMessage());
      return PageOutcome.failed(url, error.message());
    }
  }

  private static void notify(Consumer<PageOutcome> onClassified, PageOutcome outcome) {
    try {
      onClassified.accept(outcome);
    } catch (RuntimeException e) {
      log.error("Outcome listener failed for {}: {}", outcome.url(), e.getMessage(), e);
    }
  }

  private static void count(
      PageOutcome outcome,
      AtomicInteger successful,
      AtomicInteger failed,
      AtomicInteger skipped) {
    if (outcome.type() == PageOutcome.Type.SUCCESS) {
      successful.incrementAndGet();
    } else if (outcome.type() == PageOutcome.Type.FAILED) {
      failed.incrementAndGet();
    } else {
      skipped.incrementAndGet();
    }
  }
}
