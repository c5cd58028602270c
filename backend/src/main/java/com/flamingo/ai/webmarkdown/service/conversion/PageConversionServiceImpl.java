package com.flamingo.ai.webmarkdown.service.conversion;

import com.flamingo.ai.webmarkdown.config.ConversionConfig;
import com.flamingo.ai.webmarkdown.exception.ContentConversionException;
import com.flamingo.ai.webmarkdown.model.ConversionRequest;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.MarkdownResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import com.flamingo.ai.webmarkdown.service.filter.ContentFilterRouter;
import com.flamingo.ai.webmarkdown.service.html.HtmlNormalizer;
import com.flamingo.ai.webmarkdown.service.markdown.MarkdownGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs normalize, filter and generate for one page and maps every failure to an empty result. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageConversionServiceImpl implements PageConversionService {

  private final HtmlNormalizer htmlNormalizer;
  private final ContentFilterRouter filterRouter;
  private final MarkdownGenerator markdownGenerator;
  private final ConversionConfig conversionConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public MarkdownResult convert(ConversionRequest request) {
    FilterOptions options = request.filterOptions();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      MarkdownResult result = runPipeline(request);
      meterRegistry.counter("webmarkdown.conversions", "filter", options.name()).increment();
      log.debug(
          "Converted {} with filter {}: {} words",
          request.url(),
          options.name(),
          result.wordCount());
      return result;
    } catch (ContentConversionException e) {
      log.error("{} for {}: {}", e.getUserMessage(), e.getUrl(), e.getMessage(), e);
      meterRegistry.counter("webmarkdown.conversions.failed").increment();
      return MarkdownResult.empty(options);
    } catch (RuntimeException e) {
      log.error("Unexpected error converting {}: {}", request.url(), e.getMessage(), e);
      meterRegistry.counter("webmarkdown.conversions.failed").increment();
      return MarkdownResult.empty(options);
    } finally {
      sample.stop(meterRegistry.timer("webmarkdown.conversion.duration"));
    }
  }

  @Override
  public MarkdownResult convert(String html, String url, String query, boolean usePruning) {
    return convert(new ConversionRequest(html, url, selectOptions(query, usePruning)));
  }

  /** Non-blank query selects BM25, else pruning if requested, else no filter. */
  FilterOptions selectOptions(String query, boolean usePruning) {
    if (query != null && !query.isBlank()) {
      return conversionConfig.getBm25().toOptions(query.trim());
    }
    if (usePruning) {
      return conversionConfig.getPruning().toOptions();
    }
    return FilterOptions.none();
  }

  private MarkdownResult runPipeline(ConversionRequest request) {
    NormalizedPage page = normalize(request);
    if (page.isEmpty()) {
      log.warn("No content found in page {}", request.url());
      return MarkdownResult.empty(request.filterOptions());
    }
    FilterResult filterResult =
        filterRouter.route(request.filterOptions()).filter(page, request.filterOptions());
    return markdownGenerator.generate(page, filterResult);
  }

  private NormalizedPage normalize(ConversionRequest request) {
    try {
      return htmlNormalizer.normalize(request.html(), request.url());
    } catch (RuntimeException e) {
      throw new ContentConversionException(request.url(), "HTML normalization failed", e);
    }
  }
}
