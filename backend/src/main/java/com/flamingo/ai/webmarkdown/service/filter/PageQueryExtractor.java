package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Derives a relevance query from page metadata when the caller supplied none.
 *
 * <p>Sources, first non-blank wins: {@code <title>}, meta description, meta keywords, the first
 * {@code h1}, the first paragraph longer than {@value #MIN_PARAGRAPH_LENGTH} characters (cut to
 * {@value #MAX_PARAGRAPH_QUERY_LENGTH}).
 */
@Component
@Slf4j
public class PageQueryExtractor {

  static final int MIN_PARAGRAPH_LENGTH = 50;
  static final int MAX_PARAGRAPH_QUERY_LENGTH = 200;

  /**
   * Returns the derived query.
   *
   * @param page normalized page
   * @return query text, empty if the page offers nothing usable
   */
  public String extract(NormalizedPage page) {
    Document document = page.document();

    String title = document.title();
    if (!title.isBlank()) {
      return logged("title", title.trim());
    }
    String description = metaContent(document, "description");
    if (!description.isBlank()) {
      return logged("meta description", description);
    }
    String keywords = metaContent(document, "keywords");
    if (!keywords.isBlank()) {
      return logged("meta keywords", keywords);
    }
    Element h1 = document.body().selectFirst("h1");
    if (h1 != null && h1.hasText()) {
      return logged("h1", h1.text());
    }
    Element paragraph = document.body().selectFirst("p");
    if (paragraph != null && paragraph.text().length() > MIN_PARAGRAPH_LENGTH) {
      String text = paragraph.text();
      int end = Math.min(MAX_PARAGRAPH_QUERY_LENGTH, text.length());
      return logged("first paragraph", text.substring(0, end));
    }
    return "";
  }

  private static String metaContent(Document document, String name) {
    Element meta = document.selectFirst("meta[name=" + name + "]");
    return meta != null ? meta.attr("content").trim() : "";
  }

  private static String logged(String source, String query) {
    log.debug("Derived BM25 query from {}: '{}'", source, query);
    return query;
  }
}
