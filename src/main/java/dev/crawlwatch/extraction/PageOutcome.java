package dev.crawlwatch.extraction;

import org.jspecify.annotations.Nullable;

/**
 * Classification of one extraction unit.
 *
 * @param url the page
 * @param type what happened
 * @param errorMessage classified message for {@link Type#FAILED}, otherwise null
 * @param contentChanged for {@link Type#SUCCESS}, whether a new version was stored
 */
public record PageOutcome(
    String url, Type type, @Nullable String errorMessage, boolean contentChanged) {

  public enum Type {
    SUCCESS,
    FAILED,
    SKIPPED
  }

  public static PageOutcome success(String url, boolean contentChanged) {
    return new PageOutcome(url, Type.SUCCESS, null, contentChanged);
  }

  public static PageOutcome failed(String url, String errorMessage) {
    return new PageOutcome(url, Type.FAILED, errorMessage, false);
  }

  public static PageOutcome skipped(String url) {
    return new PageOutcome(url, Type.SKIPPED, null, false);
  }
}
