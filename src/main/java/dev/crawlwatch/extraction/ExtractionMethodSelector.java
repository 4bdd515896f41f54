package dev.crawlwatch.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Picks the extraction method for a crawl by racing every {@link ExtractionStrategy} on a small
 * sample of the discovered URLs.
 *
 * <p>Each strategy runs as one task on the extraction executor and walks the sample sequentially,
 * so strategies race each other but never hit the same site with more than one request at a time.
 * The winner is the highest {@link ExtractionTrialResult#score()}; ties go to the strategy listed
 * first in {@code crawlwatch.extraction.method-priority}, then by name.
 */
@Service
public class ExtractionMethodSelector {

  private static final Logger log = LoggerFactory.getLogger(ExtractionMethodSelector.class);

  private final List<ExtractionStrategy> strategies;
  private final ExtractionProperties properties;
  private final Executor executor;

  public ExtractionMethodSelector(
      List<ExtractionStrategy> strategies,
      ExtractionProperties properties,
      @Qualifier("extractionTaskExecutor") Executor executor) {
    this.strategies = List.copyOf(strategies);
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Runs the trial over the first {@code sample-size} URLs.
   *
   * @param discoveredUrls candidate pages, in discovery order
   * @return the selection with trial results sorted best first
   * @throws TestingFailedException if the sample is empty or every strategy failed every page
   */
  public ExtractionSelection select(List<String> discoveredUrls) {
    List<String> sample =
        discoveredUrls.stream().limit(properties.getSampleSize()).collect(Collectors.toList());
    if (sample.isEmpty()) {
      throw new TestingFailedException("No pages available for testing", List.of());
    }
    if (strategies.isEmpty()) {
      throw new TestingFailedException("No extraction methods configured", List.of());
    }

    log.info(
        "Testing {} extraction methods on {} sample pages", strategies.size(), sample.size());
    List<CompletableFuture<ExtractionTrialResult>> trials = new ArrayList<>();
    for (ExtractionStrategy strategy : strategies) {
      trials.add(CompletableFuture.supplyAsync(() -> runTrial(strategy, sample), executor));
    }
    List<ExtractionTrialResult> results =
        trials.stream().map(CompletableFuture::join).sorted(ranking()).toList();

    if (results.stream().allMatch(r -> r.successes() == 0)) {
      throw new TestingFailedException(
          "All extraction methods failed on all %d sample pages".formatted(sample.size()),
          results);
    }

    ExtractionTrialResult winner = results.get(0);
    log.info(
        "Selected extraction method {} (score {}, success rate {})",
        winner.methodName(),
        winner.score(),
        winner.successRate());
    return new ExtractionSelection(winner.methodName(), results);
  }

  private ExtractionTrialResult runTrial(ExtractionStrategy strategy, List<String> sample) {
    int successes = 0;
    double totalQuality = 0.0;
    long totalMillis = 0;
    for (String url : sample) {
      long start = System.nanoTime();
      try {
        ExtractionResult result = strategy.extract(url);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        if (result != null && result.hasContent()) {
          successes++;
          totalQuality += ContentQualityScorer.score(result.markdown());
          totalMillis += elapsedMillis;
        } else {
          log.debug(
              "Method {} failed on {}: {}",
              strategy.name(),
              url,
              result == null ? "no result" : result.errorMessage());
        }
      } catch (RuntimeException e) {
        log.debug("Method {} threw on {}: {}", strategy.name(), url, e.getMessage());
      }
    }
    ExtractionTrialResult trial =
        ExtractionTrialResult.of(
            strategy.name(), successes, sample.size(), totalQuality, totalMillis);
    log.debug("Trial result for {}: {}", strategy.name(), trial);
    return trial;
  }

  private Comparator<ExtractionTrialResult> ranking() {
    List<String> priority = properties.getMethodPriority();
    return Comparator.comparingDouble(ExtractionTrialResult::score)
        .reversed()
        .thenComparingInt(
            r -> {
              int index = priority.indexOf(r.methodName());
              return index < 0 ? Integer.MAX_VALUE : index;
            })
        .thenComparing(ExtractionTrialResult::methodName);
  }
}
