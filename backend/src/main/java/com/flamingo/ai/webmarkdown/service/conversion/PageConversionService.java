package com.flamingo.ai.webmarkdown.service.conversion;

import com.flamingo.ai.webmarkdown.model.ConversionRequest;
import com.flamingo.ai.webmarkdown.model.MarkdownResult;

/** Converts fetched HTML pages into LLM-ready Markdown. */
public interface PageConversionService {

  /**
   * Converts one page with the filter named in the request.
   *
   * @param request page HTML, source URL and filter options
   * @return the conversion result; an empty result if the page could not be converted
   */
  MarkdownResult convert(ConversionRequest request);

  /**
   * Converts one page, choosing the filter from the arguments: a non-blank query selects BM25,
   * otherwise {@code usePruning} selects pruning, otherwise no filter runs. Filter parameters come
   * from configuration.
   *
   * @param html page HTML
   * @param url source URL, used to resolve relative links
   * @param query optional relevance query
   * @param usePruning whether to prune boilerplate when no query is given
   * @return the conversion result
   */
  MarkdownResult convert(String html, String url, String query, boolean usePruning);
}
