package com.flamingo.ai.webmarkdown.model;

import java.util.List;

/**
 * Outcome of one filtering pass.
 *
 * @param options the filter options that produced this result
 * @param blocks every scored block in document order, retained or not
 */
public record FilterResult(FilterOptions options, List<ContentBlock> blocks) {

  public FilterResult {
    blocks = List.copyOf(blocks);
  }

  /** Retained blocks in document order. */
  public List<ContentBlock> retained() {
    return blocks.stream().filter(ContentBlock::retained).toList();
  }

  /** {@code true} when the generator should produce fit output for this result. */
  public boolean producesFitOutput() {
    return !(options instanceof FilterOptions.None);
  }
}
