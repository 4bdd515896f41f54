package dev.crawlwatch.extraction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of running one strategy over the testing sample.
 *
 * @param methodName strategy name
 * @param score composite score in [0, 100], two decimals
 * @param successRate successful pages / attempted pages, in [0, 1]
 * @param averageQuality mean {@link ContentQualityScorer} score of successful pages
 * @param averageMillis mean duration of successful extractions, 0 when none succeeded
 * @param successes pages extracted with content
 * @param attempts pages tried
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionTrialResult(
    String methodName,
    double score,
    double successRate,
    double averageQuality,
    long averageMillis,
    int successes,
    int attempts) {

  static final long FAST_MILLIS = 2_000;
  static final long MEDIUM_MILLIS = 5_000;
  static final long SLOW_MILLIS = 10_000;

  /**
   * Builds a trial result and computes its composite score: success rate (50 points), average
   * quality (30 points) and speed (20 points).
   */
  public static ExtractionTrialResult of(
      String methodName, int successes, int attempts, double totalQuality, long totalMillis) {
    double successRate = attempts == 0 ? 0.0 : (double) successes / attempts;
    double averageQuality = successes == 0 ? 0.0 : totalQuality / successes;
    long averageMillis = successes == 0 ? 0 : totalMillis / successes;
    double raw = successRate * 50 + averageQuality * 0.30 + speedPoints(successes, averageMillis);
    double score = Math.round(raw * 100) / 100.0;
    return new ExtractionTrialResult(
        methodName, score, successRate, averageQuality, averageMillis, successes, attempts);
  }

  static int speedPoints(int successes, long averageMillis) {
    if (successes == 0) {
      return 0;
    }
    if (averageMillis <= FAST_MILLIS) {
      return 20;
    }
    if (averageMillis <= MEDIUM_MILLIS) {
      return 15;
    }
    if (averageMillis <= SLOW_MILLIS) {
      return 10;
    }
    return 5;
  }
}
