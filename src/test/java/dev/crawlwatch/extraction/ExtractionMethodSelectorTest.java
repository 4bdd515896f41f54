package dev.crawlwatch.extraction;

import static dev.crawlwatch.fixture.StubExtractionStrategy.PLAIN_TEXT;
import static dev.crawlwatch.fixture.StubExtractionStrategy.RICH_MARKDOWN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.crawlwatch.fixture.StubExtractionStrategy;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExtractionMethodSelectorTest {

  private static final List<String> URLS =
      List.of(
          "https://acme.example/",
          "https://acme.example/about",
          "https://acme.example/services",
          "https://acme.example/contact",
          "https://acme.example/blog",
          "https://acme.example/careers");

  private final Executor directExecutor = Runnable::run;
  private ExtractionProperties properties;

  @BeforeEach
  void setUp() {
    properties = new ExtractionProperties();
  }

  private ExtractionMethodSelector selector(ExtractionStrategy... strategies) {
    return new ExtractionMethodSelector(List.of(strategies), properties, directExecutor);
  }

  @Test
  void higherScoringMethodWins() {
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);
    var jina = StubExtractionStrategy.returning("jina", PLAIN_TEXT);

    ExtractionSelection selection = selector(jina, crawl4ai).select(URLS);

    assertThat(selection.winningMethod()).isEqualTo("crawl4ai");
    assertThat(selection.trialResults())
        .extracting(ExtractionTrialResult::methodName)
        .containsExactly("crawl4ai", "jina");
    assertThat(selection.trialResults().get(0).score())
        .isGreaterThan(selection.trialResults().get(1).score());
  }

  @Test
  void eachStrategyIsTriedOnTheFirstSampleSizeUrls() {
    properties.setSampleSize(2);
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);

    selector(crawl4ai).select(URLS);

    assertThat(crawl4ai.calls()).containsExactly(URLS.get(0), URLS.get(1));
  }

  @Test
  void partialFailuresLowerTheSuccessRate() {
    var flaky =
        new StubExtractionStrategy(
            "crawl4ai",
            url ->
                url.endsWith("/about")
                    ? ExtractionResult.failure(url, "timeout", null)
                    : ExtractionResult.success(url, RICH_MARKDOWN));
    var jina = StubExtractionStrategy.returning("jina", RICH_MARKDOWN);

    ExtractionSelection selection = selector(flaky, jina).select(URLS);

    assertThat(selection.winningMethod()).isEqualTo("jina");
    ExtractionTrialResult flakyResult =
        selection.trialResults().stream()
            .filter(r -> r.methodName().equals("crawl4ai"))
            .findFirst()
            .orElseThrow();
    assertThat(flakyResult.successes()).isEqualTo(4);
    assertThat(flakyResult.attempts()).isEqualTo(5);
  }

  @Test
  void thrownExceptionsCountAsFailedPages() {
    var throwing =
        new StubExtractionStrategy(
            "crawl4ai",
            url -> {
              throw new IllegalStateException("boom");
            });
    var jina = StubExtractionStrategy.returning("jina", PLAIN_TEXT);

    ExtractionSelection selection = selector(throwing, jina).select(URLS);

    assertThat(selection.winningMethod()).isEqualTo("jina");
  }

  @Test
  void tiesGoToTheConfiguredPriority() {
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);
    var jina = StubExtractionStrategy.returning("jina", RICH_MARKDOWN);

    assertThat(selector(jina, crawl4ai).select(URLS).winningMethod()).isEqualTo("crawl4ai");

    properties.setMethodPriority(List.of("jina", "crawl4ai"));
    assertThat(selector(crawl4ai, jina).select(URLS).winningMethod()).isEqualTo("jina");
  }

  @Test
  void tiesBetweenUnlistedMethodsGoByName() {
    var zeta = StubExtractionStrategy.returning("zeta", RICH_MARKDOWN);
    var alpha = StubExtractionStrategy.returning("alpha", RICH_MARKDOWN);

    assertThat(selector(zeta, alpha).select(URLS).winningMethod()).isEqualTo("alpha");
  }

  @Test
  void allMethodsFailingThrowsWithTrialResults() {
    properties.setSampleSize(3);
    var crawl4ai = StubExtractionStrategy.failing("crawl4ai", "Connection refused", null);
    var jina = StubExtractionStrategy.failing("jina", null, 403);

    assertThatThrownBy(() -> selector(crawl4ai, jina).select(URLS))
        .isInstanceOf(TestingFailedException.class)
        .hasMessage("All extraction methods failed on all 3 sample pages")
        .satisfies(
            e ->
                assertThat(((TestingFailedException) e).getTrialResults())
                    .extracting(ExtractionTrialResult::score)
                    .containsOnly(0.0));
  }

  @Test
  void blankContentIsNotASuccess() {
    var blank = StubExtractionStrategy.returning("crawl4ai", "  ");

    assertThatThrownBy(() -> selector(blank).select(URLS))
        .isInstanceOf(TestingFailedException.class);
  }

  @Test
  void emptySampleThrows() {
    var crawl4ai = StubExtractionStrategy.returning("crawl4ai", RICH_MARKDOWN);

    assertThatThrownBy(() -> selector(crawl4ai).select(List.of()))
        .isInstanceOf(TestingFailedException.class)
        .hasMessage("No pages available for testing");
    assertThat(crawl4ai.calls()).isEmpty();
  }

  @Test
  void noStrategiesThrows() {
    assertThatThrownBy(() -> selector().select(URLS))
        .isInstanceOf(TestingFailedException.class)
        .hasMessage("No extraction methods configured");
  }
}
