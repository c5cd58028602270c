package com.flamingo.ai.webmarkdown.model;

import java.util.List;
import org.jsoup.nodes.Node;

/**
 * One retain/drop unit of a page, produced by {@link
 * com.flamingo.ai.webmarkdown.service.filter.ContentBlockExtractor}.
 *
 * <p>A block usually wraps a single element. A heading is merged with the block it introduces, and
 * a run of loose inline nodes becomes one anonymous block whose {@code tagName} is {@code "p"}.
 *
 * @param index position of the block in document order (0-based)
 * @param nodes the source nodes, siblings in document order
 * @param tagName tag of the element that carries the block's content
 * @param classAndId {@code class} and {@code id} values of that element and of the containers
 *     enclosing it below the content root, space separated
 * @param text normalized text of the block
 * @param html outer markup of the block, used for fit-HTML output
 * @param textLength length of {@code text}
 * @param linkTextLength length of the text inside anchors
 * @param wordCount whitespace-delimited word count of {@code text}
 * @param score score assigned by the filter that ran (0 before scoring)
 * @param retained whether the filter kept this block
 */
public record ContentBlock(
    int index,
    List<Node> nodes,
    String tagName,
    String classAndId,
    String text,
    String html,
    int textLength,
    int linkTextLength,
    int wordCount,
    double score,
    boolean retained) {

  public ContentBlock {
    nodes = List.copyOf(nodes);
  }

  /** Ratio of anchor text to total text; a block without text counts as all-link. */
  public double linkDensity() {
    return textLength > 0 ? Math.min(1.0, (double) linkTextLength / textLength) : 1.0;
  }

  /** Ratio of text to markup length, capped at 1. */
  public double textDensity() {
    return html.isEmpty() ? 0.0 : Math.min(1.0, (double) textLength / html.length());
  }

  public ContentBlock withScore(double newScore) {
    return new ContentBlock(
        index,
        nodes,
        tagName,
        classAndId,
        text,
        html,
        textLength,
        linkTextLength,
        wordCount,
        newScore,
        retained);
  }

  public ContentBlock withRetained(boolean keep) {
    return new ContentBlock(
        index,
        nodes,
        tagName,
        classAndId,
        text,
        html,
        textLength,
        linkTextLength,
        wordCount,
        score,
        keep);
  }
}
