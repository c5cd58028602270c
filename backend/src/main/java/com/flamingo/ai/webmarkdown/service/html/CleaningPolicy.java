package com.flamingo.ai.webmarkdown.service.html;

import java.util.List;
import java.util.Set;

/**
 * Tag and selector tables driving {@link HtmlNormalizer}.
 *
 * <p>{@link #DEFAULT} is built once at class-load time and never mutated; all collections are
 * unmodifiable.
 *
 * @param removeTags elements removed together with their subtree
 * @param unwrapTags inline wrappers replaced by their children on the plain-text path
 * @param mainContentSelectors main-content candidates, highest priority first
 * @param fallbackRemovalSelectors regions removed from the body when no candidate matches
 */
public record CleaningPolicy(
    Set<String> removeTags,
    Set<String> unwrapTags,
    List<String> mainContentSelectors,
    List<String> fallbackRemovalSelectors) {

  public static final CleaningPolicy DEFAULT =
      new CleaningPolicy(
          Set.of(
              "script", "style", "noscript", "iframe", "svg", "canvas", "video", "audio", "form",
              "input", "button", "select", "textarea"),
          Set.of("span", "font", "b", "i", "u", "strong", "em"),
          List.of("main", "article", "[role=main]", "#content", ".content", "#main", ".main"),
          List.of("nav", "header", "footer", "aside", ".sidebar", "#sidebar", ".nav", ".menu"));

  public CleaningPolicy {
    removeTags = Set.copyOf(removeTags);
    unwrapTags = Set.copyOf(unwrapTags);
    mainContentSelectors = List.copyOf(mainContentSelectors);
    fallbackRemovalSelectors = List.copyOf(fallbackRemovalSelectors);
  }
}
