package com.flamingo.ai.webmarkdown.service.html;

import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Service;

/**
 * Parses raw page markup and isolates its main-content region.
 *
 * <p>Parsing goes through jsoup's HTML5 tree builder, which never rejects input: malformed markup
 * is repaired and empty input yields a document with an empty body. Cleaning removes, in order:
 *
 * <ol>
 *   <li>comment nodes
 *   <li>elements in {@link CleaningPolicy#removeTags()}, with their subtree
 *   <li>hidden elements ({@code display:none}, {@code hidden}, {@code aria-hidden="true"})
 * </ol>
 *
 * <p>The main content is the first match of the highest-priority candidate selector. Without a
 * match, the body is used after removing navigation-like regions.
 */
@Service
@Slf4j
public class HtmlNormalizer {

  /**
   * Parses, cleans and isolates the main content of a page.
   *
   * @param html raw markup, may be {@code null}, blank or malformed
   * @param baseUrl URL used to resolve relative links, may be {@code null}
   * @param policy cleaning tables
   * @return the normalized page, never {@code null}
   */
  public NormalizedPage normalize(String html, String baseUrl, CleaningPolicy policy) {
    Document document = parseAndClean(html, baseUrl, policy);

    for (String selector : policy.mainContentSelectors()) {
      Element candidate = document.selectFirst(selector);
      if (candidate != null) {
        log.debug("Main content matched selector '{}' (<{}>)", selector, candidate.tagName());
        return new NormalizedPage(document, candidate, true, baseUrl);
      }
    }

    Element body = document.body();
    int removed = 0;
    for (String selector : policy.fallbackRemovalSelectors()) {
      for (Element element : body.select(selector)) {
        if (element != body) {
          element.remove();
          removed++;
        }
      }
    }
    log.debug("No main-content candidate matched; using body with {} regions removed", removed);
    return new NormalizedPage(document, body, false, baseUrl);
  }

  public NormalizedPage normalize(String html, String baseUrl) {
    return normalize(html, baseUrl, CleaningPolicy.DEFAULT);
  }

  /**
   * Returns the cleaned body markup of a page, without main-content isolation.
   *
   * @param html raw markup
   * @return cleaned inner HTML of the body, empty for blank input
   */
  public String clean(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return parseAndClean(html, "", CleaningPolicy.DEFAULT).body().html();
  }

  /**
   * Extracts readable plain text, one line per block, with inline formatting wrappers unwrapped.
   *
   * @param html raw markup
   * @param policy cleaning tables
   * @return trimmed non-blank lines joined by {@code \n}
   */
  public String extractText(String html, CleaningPolicy policy) {
    if (html == null || html.isBlank()) {
      return "";
    }
    Document document = parseAndClean(html, "", policy);
    if (!policy.unwrapTags().isEmpty()) {
      document.body().select(String.join(", ", policy.unwrapTags())).unwrap();
    }

    StringBuilder text = new StringBuilder();
    NodeTraversor.traverse(new LineCollector(text), document.body());

    List<String> lines = new ArrayList<>();
    for (String line : text.toString().split("\n")) {
      String trimmed = line.replaceAll("\\s+", " ").trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    return String.join("\n", lines);
  }

  public String extractText(String html) {
    return extractText(html, CleaningPolicy.DEFAULT);
  }

  // ---- private helpers ----

  private Document parseAndClean(String html, String baseUrl, CleaningPolicy policy) {
    Document document = Jsoup.parse(html != null ? html : "", baseUrl != null ? baseUrl : "");
    document.outputSettings().prettyPrint(false);

    int comments = removeComments(document);
    Elements removable =
        policy.removeTags().isEmpty()
            ? new Elements()
            : document.select(String.join(", ", policy.removeTags()));
    removable.remove();
    int hidden = removeHidden(document);

    log.debug(
        "Cleaned document: {} comments, {} removable elements, {} hidden elements removed",
        comments,
        removable.size(),
        hidden);
    return document;
  }

  private int removeComments(Document document) {
    List<Node> comments = new ArrayList<>();
    NodeTraversor.traverse(
        (node, depth) -> {
          if (node instanceof Comment) {
            comments.add(node);
          }
        },
        document);
    comments.forEach(Node::remove);
    return comments.size();
  }

  private int removeHidden(Document document) {
    List<Element> hidden = new ArrayList<>();
    for (Element element : document.getAllElements()) {
      if (element == document.body() || element == document.firstElementChild()) {
        continue;
      }
      if (isHidden(element)) {
        hidden.add(element);
      }
    }
    hidden.forEach(Element::remove);
    return hidden.size();
  }

  static boolean isHidden(Element element) {
    if (element.hasAttr("hidden")) {
      return true;
    }
    if ("true".equals(element.attr("aria-hidden"))) {
      return true;
    }
    String style = element.attr("style");
    if (style.isEmpty()) {
      return false;
    }
    return style.replaceAll("\\s", "").toLowerCase(Locale.ROOT).contains("display:none");
  }

  /** Appends text nodes and breaks lines after block elements and {@code <br>}. */
  private static final class LineCollector implements NodeVisitor {

    private final StringBuilder out;

    LineCollector(StringBuilder out) {
      this.out = out;
    }

    @Override
    public void head(Node node, int depth) {
      if (node instanceof TextNode textNode) {
        out.append(textNode.getWholeText());
      } else if (node instanceof Element element && "br".equals(element.normalName())) {
        out.append('\n');
      }
    }

    @Override
    public void tail(Node node, int depth) {
      if (node instanceof Element element && element.isBlock()) {
        out.append('\n');
      }
    }
  }
}
