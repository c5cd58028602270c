package com.flamingo.ai.webmarkdown.service.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Converts a jsoup element tree into Markdown.
 *
 * <p>One instance renders one tree: it owns the {@link CitationRegistry} filled while links are
 * rendered. Not thread-safe; create a new instance per conversion.
 */
public final class MarkdownRenderer {

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "address", "article", "aside", "blockquote", "body", "center", "dd", "details", "dialog",
          "div", "dl", "dt", "fieldset", "figcaption", "figure", "footer", "h1", "h2", "h3", "h4",
          "h5", "h6", "header", "hgroup", "hr", "html", "li", "main", "menu", "nav", "ol", "p",
          "pre", "section", "summary", "table", "ul");

  private static final Pattern LANGUAGE_CLASS = Pattern.compile("(?:lang|language)-([\\w+#.-]+)");
  private static final Pattern BACKTICK_RUN = Pattern.compile("`+");

  private final boolean ignoreLinks;
  private final boolean ignoreImages;
  private final CitationRegistry citations = new CitationRegistry();

  public MarkdownRenderer(boolean ignoreLinks, boolean ignoreImages) {
    this.ignoreLinks = ignoreLinks;
    this.ignoreImages = ignoreImages;
  }

  /**
   * Renders an element and its subtree.
   *
   * @param root subtree root; rendered as a block
   * @return cleaned Markdown, empty if the tree has no content
   */
  public String render(Element root) {
    StringBuilder out = new StringBuilder();
    if (isBlock(root)) {
      renderBlock(root, out, 0);
    } else {
      appendParagraph(out, renderInline(root));
    }
    return MarkdownCleaner.clean(out.toString());
  }

  public CitationRegistry citations() {
    return citations;
  }

  // ---- block rendering ----

  private void renderBlock(Element element, StringBuilder out, int listDepth) {
    String tag = element.normalName();
    switch (tag) {
      case "h1", "h2", "h3", "h4", "h5", "h6" -> renderHeading(element, out);
      case "p" -> appendParagraph(out, renderInlineChildren(element));
      case "ul" -> renderList(element, out, listDepth, false);
      case "ol" -> renderList(element, out, listDepth, true);
      case "pre" -> renderPre(element, out);
      case "blockquote" -> renderBlockquote(element, out);
      case "table" -> renderTable(element, out);
      case "hr" -> out.append("---\n\n");
      case "li" -> {
        StringBuilder item = new StringBuilder();
        renderListItem(element, item, listDepth, "- ");
        out.append(item).append('\n');
      }
      default -> renderBlockChildren(element, out, listDepth);
    }
  }

  /** Renders children of a block container, grouping loose inline nodes into paragraphs. */
  private void renderBlockChildren(Element container, StringBuilder out, int listDepth) {
    StringBuilder paragraph = new StringBuilder();
    for (Node child : container.childNodes()) {
      if (child instanceof Element element && isBlock(element)) {
        appendParagraph(out, paragraph.toString());
        paragraph.setLength(0);
        renderBlock(element, out, listDepth);
      } else {
        paragraph.append(renderInline(child));
      }
    }
    appendParagraph(out, paragraph.toString());
  }

  private void renderHeading(Element heading, StringBuilder out) {
    int level = heading.normalName().charAt(1) - '0';
    String text = collapse(renderInlineChildren(heading).replace('\n', ' ')).trim();
    if (!text.isEmpty()) {
      out.append("#".repeat(level)).append(' ').append(text).append("\n\n");
    }
  }

  private void renderList(Element list, StringBuilder out, int depth, boolean ordered) {
    int number = ordered ? parseStart(list) : 0;
    for (Element child : list.children()) {
      if (isList(child)) {
        renderList(child, out, depth + 1, "ol".equals(child.normalName()));
        continue;
      }
      String marker = ordered ? (number++) + ". " : "- ";
      renderListItem(child, out, depth, marker);
    }
    if (depth == 0) {
      out.append('\n');
    }
  }

  /**
   * Renders one list item. Inline content goes on the marker line; block children (code, quotes,
   * paragraphs, tables) are rendered as blocks indented under the marker; nested lists go one
   * level deeper.
   */
  private void renderListItem(Element item, StringBuilder out, int depth, String marker) {
    String indent = "  ".repeat(depth);
    String continuation = indent + " ".repeat(marker.length());
    StringBuilder text = new StringBuilder();
    boolean started = false;
    for (Node child : item.childNodes()) {
      if (!(child instanceof Element element) || !isBlock(element)) {
        text.append(renderInline(child));
        continue;
      }
      started |= appendItemText(out, text, started ? continuation : indent + marker);
      text.setLength(0);
      if (isList(element)) {
        if (!started) {
          out.append(indent).append(marker).append('\n');
          started = true;
        }
        renderList(element, out, depth + 1, "ol".equals(element.normalName()));
      } else {
        StringBuilder block = new StringBuilder();
        renderBlock(element, block, 0);
        String rendered = MarkdownCleaner.clean(block.toString());
        if (!rendered.isEmpty()) {
          appendIndented(out, rendered, started ? continuation : indent + marker, continuation);
          started = true;
        }
      }
    }
    appendItemText(out, text, started ? continuation : indent + marker);
  }

  private static boolean appendItemText(StringBuilder out, StringBuilder text, String prefix) {
    String content = collapse(text.toString().replace('\n', ' ')).trim();
    if (content.isEmpty()) {
      return false;
    }
    out.append(prefix).append(content).append('\n');
    return true;
  }

  private static void appendIndented(
      StringBuilder out, String rendered, String firstPrefix, String prefix) {
    String[] lines = rendered.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].isEmpty()) {
        out.append('\n');
      } else {
        out.append(i == 0 ? firstPrefix : prefix).append(lines[i]).append('\n');
      }
    }
  }

  private void renderPre(Element pre, StringBuilder out) {
    String code = pre.wholeText();
    if (code.isBlank()) {
      return;
    }
    String info = languageOf(pre);
    Element codeChild = pre.selectFirst("code");
    if (info.isEmpty() && codeChild != null) {
      info = languageOf(codeChild);
    }
    String fence = fenceFor(code);
    out.append(fence).append(info).append('\n').append(code);
    if (!code.endsWith("\n")) {
      out.append('\n');
    }
    out.append(fence).append("\n\n");
  }

  private void renderBlockquote(Element quote, StringBuilder out) {
    StringBuilder inner = new StringBuilder();
    renderBlockChildren(quote, inner, 0);
    String content = MarkdownCleaner.clean(inner.toString());
    if (content.isEmpty()) {
      return;
    }
    for (String line : content.split("\n", -1)) {
      out.append(line.isEmpty() ? ">" : "> " + line).append('\n');
    }
    out.append('\n');
  }

  private void renderTable(Element table, StringBuilder out) {
    List<List<String>> rows = new ArrayList<>();
    int columns = 0;
    for (Element row : table.select("tr")) {
      List<String> cells = new ArrayList<>();
      for (Element cell : row.children()) {
        if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
          String text = collapse(renderInlineChildren(cell).replace('\n', ' ')).trim();
          cells.add(text.replace("|", "\\|"));
        }
      }
      if (!cells.isEmpty()) {
        rows.add(cells);
        columns = Math.max(columns, cells.size());
      }
    }
    if (rows.isEmpty()) {
      return;
    }
    for (int r = 0; r < rows.size(); r++) {
      StringBuilder line = new StringBuilder("|");
      for (int c = 0; c < columns; c++) {
        List<String> cells = rows.get(r);
        line.append(' ').append(c < cells.size() ? cells.get(c) : "").append(" |");
      }
      out.append(line).append('\n');
      if (r == 0) {
        out.append('|').append("---|".repeat(columns)).append('\n');
      }
    }
    out.append('\n');
  }

  // ---- inline rendering ----

  private String renderInlineChildren(Element element) {
    StringBuilder sb = new StringBuilder();
    for (Node child : element.childNodes()) {
      sb.append(renderInline(child));
    }
    return sb.toString();
  }

  private String renderInline(Node node) {
    if (node instanceof TextNode text) {
      return text.getWholeText().replaceAll("\\s+", " ");
    }
    if (!(node instanceof Element element)) {
      return "";
    }
    String tag = element.normalName();
    switch (tag) {
      case "br":
        return "\n";
      case "strong":
      case "b":
        return wrap(renderInlineChildren(element), "**");
      case "em":
      case "i":
        return wrap(renderInlineChildren(element), "*");
      case "code":
        return inlineCode(element.wholeText());
      case "pre":
        return " " + inlineCode(element.wholeText()) + " ";
      case "a":
        return renderLink(element);
      case "img":
        return renderImage(element);
      default:
        String inner = renderInlineChildren(element);
        return isBlock(element) ? " " + inner + " " : inner;
    }
  }

  private String renderLink(Element anchor) {
    String text = collapse(renderInlineChildren(anchor).replace('\n', ' ')).trim();
    String href = anchor.attr("href").trim();
    if (ignoreLinks || href.isEmpty() || href.toLowerCase().startsWith("javascript:")) {
      return text;
    }
    String url = resolve(anchor, "href");
    if (text.isEmpty()) {
      text = url;
    }
    citations.register(url, anchor.text().trim());
    return "[" + text + "](" + url + ")";
  }

  private String renderImage(Element image) {
    if (ignoreImages || image.attr("src").isBlank()) {
      return "";
    }
    String alt = collapse(image.attr("alt")).trim();
    return "![" + alt + "](" + resolve(image, "src") + ")";
  }

  // ---- helpers ----

  private static void appendParagraph(StringBuilder out, String inline) {
    String text = collapse(inline).strip();
    if (!text.isEmpty()) {
      out.append(text.replaceAll(" *\n *", "\n")).append("\n\n");
    }
  }

  private static String resolve(Element element, String attribute) {
    String absolute = element.absUrl(attribute);
    String url = absolute.isEmpty() ? element.attr(attribute).trim() : absolute;
    return url.replace(" ", "%20").replace(")", "%29");
  }

  private static String wrap(String inner, String marker) {
    String trimmed = inner.trim();
    if (trimmed.isEmpty()) {
      return inner;
    }
    String leading = Character.isWhitespace(inner.charAt(0)) ? " " : "";
    String trailing = Character.isWhitespace(inner.charAt(inner.length() - 1)) ? " " : "";
    return leading + marker + trimmed + marker + trailing;
  }

  private static String inlineCode(String code) {
    String text = code.replace('\n', ' ');
    if (text.isBlank()) {
      return "";
    }
    String ticks = "`".repeat(longestBacktickRun(text) + 1);
    String padding = text.startsWith("`") || text.endsWith("`") ? " " : "";
    return ticks + padding + text + padding + ticks;
  }

  private static String fenceFor(String code) {
    return "`".repeat(Math.max(3, longestBacktickRun(code) + 1));
  }

  private static int longestBacktickRun(String text) {
    int longest = 0;
    Matcher matcher = BACKTICK_RUN.matcher(text);
    while (matcher.find()) {
      longest = Math.max(longest, matcher.group().length());
    }
    return longest;
  }

  private static String languageOf(Element element) {
    Matcher matcher = LANGUAGE_CLASS.matcher(element.className());
    return matcher.find() ? matcher.group(1) : "";
  }

  private static int parseStart(Element list) {
    try {
      return list.hasAttr("start") ? Integer.parseInt(list.attr("start").trim()) : 1;
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  /** Collapses runs of spaces and tabs; line breaks from {@code <br>} survive. */
  private static String collapse(String text) {
    return text.replaceAll("[ \\t]+", " ");
  }

  private static boolean isList(Element element) {
    return "ul".equals(element.normalName()) || "ol".equals(element.normalName());
  }

  private static boolean isBlock(Element element) {
    String tag = element.normalName();
    if (BLOCK_TAGS.contains(tag)) {
      return true;
    }
    if (element.tag().isKnownTag()) {
      return false;
    }
    for (Element child : element.children()) {
      if (isBlock(child)) {
        return true;
      }
    }
    return false;
  }
}
