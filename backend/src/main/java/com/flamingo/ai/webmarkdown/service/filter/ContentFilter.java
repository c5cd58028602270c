package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;

/**
 * Partitions the content blocks of a normalized page into retained and dropped blocks.
 *
 * <p>Implementations are stateless Spring beans, one per {@link FilterOptions} variant, selected by
 * {@link ContentFilterRouter}. Results keep document order and are deterministic for identical
 * input and options.
 */
public interface ContentFilter {

  /**
   * Scores and partitions the page's blocks.
   *
   * @param page normalized page
   * @param options options of the variant this filter {@link #supports supports}
   * @return every block in document order with its score and retain flag
   */
  FilterResult filter(NormalizedPage page, FilterOptions options);

  /**
   * Returns {@code true} if this filter handles the given options variant.
   *
   * @param options filter options
   * @return {@code true} if supported
   */
  boolean supports(FilterOptions options);
}
