package dev.crawlwatch.extraction;

import java.util.regex.Pattern;

/**
 * Scores extracted Markdown from 0 to 100 by structural richness: headings, amount of text, links
 * and structured blocks (code, lists, tables). Used to compare extraction methods on the same
 * sample of pages.
 */
public final class ContentQualityScorer {

  private static final Pattern H1 = Pattern.compile("(?m)^#\\s+\\S");
  private static final Pattern H2 = Pattern.compile("(?m)^#{2,3}\\s+\\S");
  private static final Pattern LINK = Pattern.compile("\\[[^\\]]+\\]\\([^)]+\\)");
  private static final Pattern CODE = Pattern.compile("(?m)^```");
  private static final Pattern LIST_ITEM = Pattern.compile("(?m)^\\s*(?:[-*+]|\\d+\\.)\\s+\\S");
  private static final Pattern TABLE_ROW = Pattern.compile("(?m)^\\|.*\\|\\s*$");

  private ContentQualityScorer() {
    // utility class
  }

  /**
   * @param markdown extracted content, may be null
   * @return quality score in [0, 100]
   */
  public static double score(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return 0.0;
    }
    double score = 0.0;
    if (H1.matcher(markdown).find()) {
      score += 25;
    }
    if (H2.matcher(markdown).find()) {
      score += 15;
    }

    int words = markdown.trim().split("\\s+").length;
    if (words > 100) {
      score += 20;
    }
    if (words > 300) {
      score += 10;
    }

    if (LINK.matcher(markdown).find()) {
      score += 10;
    }

    int structured = 0;
    if (CODE.matcher(markdown).find()) {
      structured++;
    }
    if (LIST_ITEM.matcher(markdown).find()) {
      structured++;
    }
    if (TABLE_ROW.matcher(markdown).find()) {
      structured++;
    }
    score += Math.min(20, structured * 10);

    return Math.min(100.0, score);
  }
}
