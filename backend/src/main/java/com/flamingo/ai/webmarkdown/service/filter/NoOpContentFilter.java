package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** Keeps every block; the generator produces no fit output for this variant. */
@Service
@Order(1)
@RequiredArgsConstructor
public class NoOpContentFilter implements ContentFilter {

  private final ContentBlockExtractor blockExtractor;

  @Override
  public boolean supports(FilterOptions options) {
    return options instanceof FilterOptions.None;
  }

  @Override
  public FilterResult filter(NormalizedPage page, FilterOptions options) {
    return new FilterResult(
        options, blockExtractor.extract(page).stream().map(b -> b.withRetained(true)).toList());
  }
}
