package com.flamingo.ai.webmarkdown.model;

/**
 * The single value returned for one converted page.
 *
 * <p>{@code fitMarkdown} and {@code fitHtml} are either both present or both {@code null}; they are
 * {@code null} whenever no filter ran.
 *
 * @param rawMarkdown Markdown of the whole main-content region, never {@code null}
 * @param fitMarkdown Markdown of the retained blocks only
 * @param fitHtml markup of the retained blocks only, in document order
 * @param title page title, or {@code null}
 * @param referencesMarkdown numbered citation list, or {@code null} when the page has no links
 * @param wordCount whitespace-token count of {@code fitMarkdown} if present, else of {@code
 *     rawMarkdown}
 */
public record MarkdownResult(
    String rawMarkdown,
    String fitMarkdown,
    String fitHtml,
    String title,
    String referencesMarkdown,
    int wordCount) {

  /** Builds a result, deriving {@code wordCount} from the Markdown it describes. */
  public static MarkdownResult of(
      String rawMarkdown,
      String fitMarkdown,
      String fitHtml,
      String title,
      String referencesMarkdown) {
    String raw = rawMarkdown != null ? rawMarkdown : "";
    boolean hasFit = fitMarkdown != null && fitHtml != null;
    String fit = hasFit ? fitMarkdown : null;
    String html = hasFit ? fitHtml : null;
    return new MarkdownResult(
        raw, fit, html, title, referencesMarkdown, countWords(fit != null ? fit : raw));
  }

  /**
   * Result for a page with no usable content. Fit output is present (and empty) when a filter was
   * requested, so the fit invariant holds for degenerate input too.
   */
  public static MarkdownResult empty(FilterOptions options) {
    boolean filtered = options != null && !(options instanceof FilterOptions.None);
    return of("", filtered ? "" : null, filtered ? "" : null, null, null);
  }

  /** Number of whitespace-delimited tokens in {@code text}. */
  public static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.trim().split("\\s+").length;
  }

  /** The Markdown an LLM should read: fit output when available, raw otherwise. */
  public String bestMarkdown() {
    return fitMarkdown != null ? fitMarkdown : rawMarkdown;
  }
}
