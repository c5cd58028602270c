package com.flamingo.ai.webmarkdown.service.markdown;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers link targets in first-occurrence order. A URL seen again keeps its first number and its
 * first link text.
 */
public final class CitationRegistry {

  /** A numbered link target. */
  public record Citation(int number, String url, String text) {}

  private final Map<String, Citation> citations = new LinkedHashMap<>();

  /**
   * Records a link and returns its citation number.
   *
   * @param url absolute link target
   * @param text visible link text (plain)
   * @return 1-based citation number
   */
  public int register(String url, String text) {
    Citation existing = citations.get(url);
    if (existing != null) {
      return existing.number();
    }
    Citation citation = new Citation(citations.size() + 1, url, text);
    citations.put(url, citation);
    return citation.number();
  }

  public List<Citation> citations() {
    return List.copyOf(citations.values());
  }

  /**
   * Renders the citation list.
   *
   * @param maxReferences number of citations listed, in number order; zero or less lists all
   * @return a {@code ## References} section with one {@code [n] [text](url)} line per citation, or
   *     {@code null} when no link was recorded
   */
  public String toMarkdown(int maxReferences) {
    if (citations.isEmpty()) {
      return null;
    }
    int limit = maxReferences > 0 ? maxReferences : citations.size();
    StringBuilder sb = new StringBuilder("## References\n\n");
    for (Citation citation : citations.values()) {
      if (citation.number() > limit) {
        break;
      }
      String text = citation.text().isBlank() ? citation.url() : citation.text();
      sb.append('[')
          .append(citation.number())
          .append("] [")
          .append(text)
          .append("](")
          .append(citation.url())
          .append(")\n");
    }
    return sb.toString().trim();
  }
}
