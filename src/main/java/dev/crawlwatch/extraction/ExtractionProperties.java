package dev.crawlwatch.extraction;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for method selection and batch extraction.
 *
 * <p>Properties are bound from {@code crawlwatch.extraction.*} in application.yml.
 *
 * <ul>
 *   <li>{@code sample-size} - number of discovered URLs each strategy is tried on (default 5)
 *   <li>{@code concurrency} - extraction units in flight per batch (default 4, bounded [1, 64])
 *   <li>{@code method-priority} - tie-break order between equally scored strategies
 *   <li>{@code freshness-window} - how long a crawled page is skipped by later passes using the
 *       same method (default 24h)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "crawlwatch.extraction")
public class ExtractionProperties {

  private int sampleSize = 5;
  private int concurrency = 4;
  private List<String> methodPriority =
      new ArrayList<>(List.of(Crawl4AiExtractionStrategy.NAME, JinaExtractionStrategy.NAME));
  private Duration freshnessWindow = Duration.ofHours(24);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (sampleSize < 1) {
      throw new IllegalStateException(
          "crawlwatch.extraction.sample-size must be >= 1, got: " + sampleSize);
    }
    if (concurrency < 1 || concurrency > 64) {
      throw new IllegalStateException(
          "crawlwatch.extraction.concurrency must be in [1, 64], got: " + concurrency);
    }
    if (freshnessWindow == null || freshnessWindow.isNegative()) {
      throw new IllegalStateException(
          "crawlwatch.extraction.freshness-window must be >= 0, got: " + freshnessWindow);
    }
  }

  public int getSampleSize() {
    return sampleSize;
  }

  public void setSampleSize(int sampleSize) {
    this.sampleSize = sampleSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public List<String> getMethodPriority() {
    return methodPriority;
  }

  public void setMethodPriority(List<String> methodPriority) {
    this.methodPriority = methodPriority == null ? new ArrayList<>() : methodPriority;
  }

  public Duration getFreshnessWindow() {
    return freshnessWindow;
  }

  public void setFreshnessWindow(Duration freshnessWindow) {
    this.freshnessWindow = freshnessWindow;
  }
}
