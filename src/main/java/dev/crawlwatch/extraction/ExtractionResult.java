package dev.crawlwatch.extraction;

import org.jspecify.annotations.Nullable;

/** Result of extracting a single URL: Markdown content or an error, plus the upstream status. */
public record ExtractionResult(
    String url,
    @Nullable String markdown,
    boolean success,
    @Nullable String errorMessage,
    @Nullable Integer statusCode) {

  public static ExtractionResult success(String url, String markdown) {
    return new ExtractionResult(url, markdown, true, null, null);
  }

  public static ExtractionResult failure(
      String url, @Nullable String errorMessage, @Nullable Integer statusCode) {
    return new ExtractionResult(url, null, false, errorMessage, statusCode);
  }

  /** Successful and carrying non-blank content. */
  public boolean hasContent() {
    return success && markdown != null && !markdown.isBlank();
  }
}
