package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.MarkdownResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Splits a page's main content into {@link ContentBlock}s, the units every filter keeps or drops.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>The children of the content root are examined, whatever its tag.
 *   <li>Containers ({@code div}, {@code main}, {@code article}, {@code section}, unknown tags, …)
 *       holding block-level children are descended into; any other block-level element is one
 *       block.
 *   <li>Class and id values of the containers between a block and the content root are added to
 *       the block's {@code classAndId}.
 *   <li>Contiguous loose inline nodes (text, links, emphasis) form one anonymous block.
 *   <li>A heading followed by a sibling block is merged into it.
 *   <li>Blocks without text or images are skipped.
 * </ul>
 */
@Component
@Slf4j
public class ContentBlockExtractor {

  private static final Set<String> WRAPPER_TAGS =
      Set.of("html", "body", "div", "main", "article", "section", "center", "span", "font");

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "address", "article", "aside", "blockquote", "body", "center", "dd", "details", "dialog",
          "div", "dl", "dt", "fieldset", "figcaption", "figure", "footer", "h1", "h2", "h3", "h4",
          "h5", "h6", "header", "hgroup", "hr", "html", "li", "main", "menu", "nav", "ol", "p",
          "pre", "section", "summary", "table", "tbody", "thead", "tfoot", "tr", "td", "th", "ul");

  private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

  /**
   * Extracts the blocks of a page in document order.
   *
   * @param page normalized page
   * @return unscored blocks, indexed from 0
   */
  public List<ContentBlock> extract(NormalizedPage page) {
    Element root = page.contentRoot();
    List<NodeGroup> groups = new ArrayList<>();
    walk(root, "", groups);

    List<NodeGroup> merged = mergeHeadings(groups);
    List<ContentBlock> blocks = new ArrayList<>();
    for (NodeGroup group : merged) {
      ContentBlock block = toBlock(blocks.size(), group);
      if (block != null) {
        blocks.add(block);
      }
    }
    log.debug("Extracted {} content blocks from <{}>", blocks.size(), root.normalName());
    return blocks;
  }

  // ---- private helpers ----

  /** Sibling nodes forming one block, with the class/id values of their enclosing containers. */
  private record NodeGroup(List<Node> nodes, String ancestorHints) {}

  private void walk(Element container, String ancestorHints, List<NodeGroup> groups) {
    List<Node> inlineRun = new ArrayList<>();
    for (Node child : container.childNodes()) {
      if (child instanceof TextNode textNode) {
        if (!textNode.isBlank() || !inlineRun.isEmpty()) {
          inlineRun.add(child);
        }
      } else if (child instanceof Element element) {
        if (isBlockLevel(element)) {
          flush(inlineRun, ancestorHints, groups);
          if (isWrapper(element) && hasBlockChildren(element)) {
            walk(element, join(ancestorHints, hintsOf(element)), groups);
          } else {
            groups.add(new NodeGroup(List.of(element), ancestorHints));
          }
        } else {
          inlineRun.add(element);
        }
      }
    }
    flush(inlineRun, ancestorHints, groups);
  }

  private void flush(List<Node> inlineRun, String ancestorHints, List<NodeGroup> groups) {
    while (!inlineRun.isEmpty()
        && inlineRun.get(inlineRun.size() - 1) instanceof TextNode text
        && text.isBlank()) {
      inlineRun.remove(inlineRun.size() - 1);
    }
    if (!inlineRun.isEmpty()) {
      groups.add(new NodeGroup(List.copyOf(inlineRun), ancestorHints));
      inlineRun.clear();
    }
  }

  private List<NodeGroup> mergeHeadings(List<NodeGroup> groups) {
    List<NodeGroup> result = new ArrayList<>(groups);
    for (int i = result.size() - 2; i >= 0; i--) {
      List<Node> current = result.get(i).nodes();
      List<Node> next = result.get(i + 1).nodes();
      Node first = current.get(0);
      if (current.size() == 1
          && first instanceof Element heading
          && HEADING_TAGS.contains(heading.normalName())
          && next.get(0).parent() == heading.parent()) {
        List<Node> combined = new ArrayList<>(current);
        combined.addAll(next);
        result.set(i, new NodeGroup(combined, result.get(i).ancestorHints()));
        result.remove(i + 1);
      }
    }
    return result;
  }

  private ContentBlock toBlock(int index, NodeGroup group) {
    List<Node> nodes = group.nodes();
    boolean anonymous = nodes.stream().noneMatch(n -> n instanceof Element e && isBlockLevel(e));
    StringBuilder text = new StringBuilder();
    StringBuilder html = new StringBuilder();
    int linkTextLength = 0;
    boolean hasImage = false;

    for (Node node : nodes) {
      if (node instanceof Element element) {
        if (anonymous) {
          text.append(element.wholeText());
        } else {
          appendText(text, element.text());
        }
        linkTextLength += linkTextLength(element);
        hasImage |= "img".equals(element.normalName()) || !element.select("img[src]").isEmpty();
      } else if (node instanceof TextNode textNode) {
        if (anonymous) {
          text.append(textNode.getWholeText());
        } else {
          appendText(text, textNode.text());
        }
      }
      html.append(node.outerHtml());
    }

    String normalized = text.toString().replaceAll("\\s+", " ").trim();
    if (normalized.isEmpty() && !hasImage) {
      return null;
    }

    Element primary = primaryElement(nodes);
    String tagName = anonymous || primary == null ? "p" : primary.normalName();
    String classAndId = join(primary == null ? "" : hintsOf(primary), group.ancestorHints());
    String markup = anonymous ? "<p>" + html.toString().trim() + "</p>" : html.toString();

    return new ContentBlock(
        index,
        nodes,
        tagName,
        classAndId,
        normalized,
        markup,
        normalized.length(),
        Math.min(linkTextLength, normalized.length()),
        MarkdownResult.countWords(normalized),
        0.0,
        false);
  }

  /** The element that carries the block's content: the last block-level element, if any. */
  private Element primaryElement(List<Node> nodes) {
    Element primary = null;
    for (Node node : nodes) {
      if (node instanceof Element element) {
        if (primary == null || isBlockLevel(element)) {
          primary = element;
        }
      }
    }
    return primary;
  }

  private static String hintsOf(Element element) {
    return (element.className() + " " + element.id()).trim();
  }

  private static String join(String first, String second) {
    return (first + " " + second).trim();
  }

  private static int linkTextLength(Element element) {
    if ("a".equals(element.normalName())) {
      return element.text().length();
    }
    int length = 0;
    for (Element anchor : element.select("a")) {
      length += anchor.text().length();
    }
    return length;
  }

  private static void appendText(StringBuilder text, String part) {
    if (part.isBlank()) {
      return;
    }
    if (text.length() > 0 && !Character.isWhitespace(text.charAt(text.length() - 1))) {
      text.append(' ');
    }
    text.append(part.trim());
  }

  static boolean isBlockLevel(Element element) {
    String tag = element.normalName();
    if (BLOCK_TAGS.contains(tag)) {
      return true;
    }
    return !element.tag().isKnownTag() && hasBlockChildren(element);
  }

  static boolean isWrapper(Element element) {
    String tag = element.normalName();
    return WRAPPER_TAGS.contains(tag) || !element.tag().isKnownTag();
  }

  private static boolean hasBlockChildren(Element element) {
    for (Element child : element.children()) {
      if (isBlockLevel(child)) {
        return true;
      }
    }
    return false;
  }
}
