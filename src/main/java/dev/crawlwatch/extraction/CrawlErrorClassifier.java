package dev.crawlwatch.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Classifies extraction errors from their HTTP status code and message text.
 *
 * <p>Status codes win over message patterns. Patterns are checked in order: network, timeout, bot
 * detection, parsing; so "connection timeout" is a network error.
 */
public final class CrawlErrorClassifier {

  private static final List<Pattern> NETWORK =
      compile(
          "dns",
          "connection.*refused",
          "connection.*reset",
          "connection.*timeout",
          "ssl.*error",
          "certificate",
          "handshake",
          "network.*unreachable",
          "unknownhost");

  private static final List<Pattern> TIMEOUT =
      compile("timeout", "timed out", "deadline exceeded", "took too long");

  private static final List<Pattern> BOT_DETECTION =
      compile(
          "cloudflare",
          "access denied",
          "forbidden",
          "captcha",
          "blocked",
          "robot",
          "automation.*detected");

  private static final List<Pattern> PARSING =
      compile("parse.*error", "invalid.*html", "javascript.*error", "script.*error");

  private CrawlErrorClassifier() {
    // utility class
  }

  public static ClassifiedError classify(
      @Nullable String errorMessage, @Nullable Integer statusCode) {
    String raw = errorMessage == null ? "" : errorMessage;
    ErrorCategory category;
    boolean retryable;
    if (statusCode != null && statusCode == 403) {
      category = ErrorCategory.BOT_DETECTION;
      retryable = true;
    } else if (statusCode != null && statusCode >= 400 && statusCode < 500) {
      category = ErrorCategory.CLIENT_ERROR;
      retryable = false;
    } else if (statusCode != null && statusCode >= 500 && statusCode < 600) {
      category = ErrorCategory.SERVER_ERROR;
      retryable = true;
    } else {
      category = classifyMessage(raw.toLowerCase());
      retryable = true;
    }
    return new ClassifiedError(category, retryable, category.userMessage(raw));
  }

  /** Classify an exception thrown by a strategy, using its message chain. */
  public static ClassifiedError classify(Throwable error) {
    StringBuilder text = new StringBuilder();
    for (Throwable t = error; t != null; t = t.getCause()) {
      text.append(t.getClass().getSimpleName()).append(": ").append(t.getMessage()).append(' ');
    }
    ClassifiedError classified = classify(text.toString(), null);
    if (classified.category() == ErrorCategory.UNKNOWN) {
      String message = error.getMessage() != null ? error.getMessage() : error.toString();
      return new ClassifiedError(
          ErrorCategory.UNKNOWN, true, ErrorCategory.UNKNOWN.userMessage(message));
    }
    return classified;
  }

  private static ErrorCategory classifyMessage(String lower) {
    if (matchesAny(NETWORK, lower)) {
      return ErrorCategory.NETWORK;
    }
    if (matchesAny(TIMEOUT, lower)) {
      return ErrorCategory.TIMEOUT;
    }
    if (matchesAny(BOT_DETECTION, lower)) {
      return ErrorCategory.BOT_DETECTION;
    }
    if (matchesAny(PARSING, lower)) {
      return ErrorCategory.PARSING;
    }
    return ErrorCategory.UNKNOWN;
  }

  private static boolean matchesAny(List<Pattern> patterns, String text) {
    return patterns.stream().anyMatch(p -> p.matcher(text).find());
  }

  private static List<Pattern> compile(String... regexes) {
    return Arrays.stream(regexes).map(Pattern::compile).toList();
  }
}
