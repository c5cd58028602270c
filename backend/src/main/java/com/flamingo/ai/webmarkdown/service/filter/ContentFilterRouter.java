package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.FilterOptions;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a {@link FilterOptions} variant to the {@link ContentFilter} that implements it.
 *
 * <p>Filters are injected by Spring in {@code @Order} order; the first one that supports the
 * options wins. This is the only place where the filter variant is dispatched on.
 */
@Service
@RequiredArgsConstructor
public class ContentFilterRouter {

  private final List<ContentFilter> filters;

  /**
   * Returns the filter for the given options.
   *
   * @param options filter options
   * @return the matching filter
   * @throws IllegalStateException if no filter supports the options (should not happen)
   */
  public ContentFilter route(FilterOptions options) {
    return filters.stream()
        .filter(f -> f.supports(options))
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No ContentFilter found for options: " + options));
  }
}
