package dev.crawlwatch.extraction;

/** Categories of per-page extraction failures, each with the message shown to users. */
public enum ErrorCategory {
  NETWORK("Network error - Unable to connect to website"),
  TIMEOUT("Request timed out - Website took too long to respond"),
  CLIENT_ERROR("Page not found or access denied"),
  SERVER_ERROR("Website server error - Try again later"),
  BOT_DETECTION("Bot detection - Website blocked automated access"),
  PARSING("Content parsing error - Unable to extract data"),
  UNKNOWN(null);

  private final String userMessage;

  ErrorCategory(String userMessage) {
    this.userMessage = userMessage;
  }

  /** Human-readable message; {@code UNKNOWN} echoes the first 100 chars of the raw error. */
  public String userMessage(String rawMessage) {
    if (userMessage != null) {
      return userMessage;
    }
    String raw = rawMessage == null ? "" : rawMessage;
    return "Error: " + (raw.length() > 100 ? raw.substring(0, 100) : raw);
  }
}
