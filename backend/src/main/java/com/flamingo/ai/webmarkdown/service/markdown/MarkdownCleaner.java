package com.flamingo.ai.webmarkdown.service.markdown;

/**
 * Final whitespace pass over generated Markdown. Lines inside fenced code blocks are left
 * untouched.
 */
final class MarkdownCleaner {

  private MarkdownCleaner() {}

  /**
   * Strips trailing whitespace from each line, collapses runs of blank lines to one and trims the
   * result.
   */
  static String clean(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(markdown.length());
    String openFence = null;
    boolean previousBlank = true;
    for (String line : markdown.split("\n", -1)) {
      if (openFence != null) {
        sb.append(line).append('\n');
        if (line.strip().equals(openFence)) {
          openFence = null;
        }
        previousBlank = false;
        continue;
      }
      String trimmed = line.stripTrailing();
      if (trimmed.isEmpty()) {
        if (!previousBlank) {
          sb.append('\n');
        }
        previousBlank = true;
        continue;
      }
      String fence = fenceOf(trimmed);
      if (fence != null) {
        openFence = fence;
      }
      sb.append(trimmed).append('\n');
      previousBlank = false;
    }
    return sb.toString().strip();
  }

  /** The backtick run opening a fence on this line, or {@code null}. */
  private static String fenceOf(String line) {
    String stripped = line.stripLeading();
    int count = 0;
    while (count < stripped.length() && stripped.charAt(count) == '`') {
      count++;
    }
    return count >= 3 ? stripped.substring(0, count) : null;
  }
}
