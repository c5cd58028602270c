package com.flamingo.ai.webmarkdown.model;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * A cleaned page and its main-content region.
 *
 * @param document the cleaned document (comments, removable and hidden elements gone)
 * @param contentRoot the element holding the main content; the body when no candidate matched
 * @param fromCandidate {@code true} if {@code contentRoot} matched a main-content selector
 * @param baseUrl URL the page was fetched from, used to resolve relative links (may be empty)
 */
public record NormalizedPage(
    Document document, Element contentRoot, boolean fromCandidate, String baseUrl) {

  public NormalizedPage {
    baseUrl = baseUrl != null ? baseUrl : "";
  }

  /** {@code true} if the content root carries no text and no images. */
  public boolean isEmpty() {
    return !contentRoot.hasText() && contentRoot.select("img[src]").isEmpty();
  }
}
