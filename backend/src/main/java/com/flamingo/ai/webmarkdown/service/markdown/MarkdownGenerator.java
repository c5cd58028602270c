package com.flamingo.ai.webmarkdown.service.markdown;

import com.flamingo.ai.webmarkdown.config.ConversionConfig;
import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.MarkdownResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Produces the {@link MarkdownResult} of a page: raw Markdown of the whole content root, fit
 * Markdown of the blocks a filter retained, the page title and the numbered references.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarkdownGenerator {

  private final ConversionConfig conversionConfig;

  public MarkdownResult generate(NormalizedPage page, FilterResult filterResult) {
    MarkdownRenderer rawRenderer = newRenderer();
    String rawMarkdown = rawRenderer.render(page.contentRoot());
    String references =
        rawRenderer.citations().toMarkdown(conversionConfig.getMarkdown().getMaxReferences());

    String fitHtml = null;
    String fitMarkdown = null;
    if (filterResult.producesFitOutput()) {
      fitHtml =
          filterResult.retained().stream()
              .map(ContentBlock::html)
              .collect(Collectors.joining("\n"));
      Document fragment = Jsoup.parseBodyFragment(fitHtml, page.baseUrl());
      fitMarkdown = newRenderer().render(fragment.body());
    }

    MarkdownResult result =
        MarkdownResult.of(rawMarkdown, fitMarkdown, fitHtml, extractTitle(page), references);
    log.debug(
        "Generated markdown: raw={} chars, fit={} chars, {} words, {} citations",
        result.rawMarkdown().length(),
        fitMarkdown != null ? fitMarkdown.length() : 0,
        result.wordCount(),
        rawRenderer.citations().citations().size());
    return result;
  }

  /** First {@code h1} of the cleaned document, else the {@code <title>}, else {@code null}. */
  String extractTitle(NormalizedPage page) {
    Element h1 = page.document().selectFirst("h1");
    if (h1 != null && !h1.text().isBlank()) {
      return h1.text().trim();
    }
    String title = page.document().title();
    return title.isBlank() ? null : title.trim();
  }

  private MarkdownRenderer newRenderer() {
    ConversionConfig.Markdown markdown = conversionConfig.getMarkdown();
    return new MarkdownRenderer(markdown.isIgnoreLinks(), markdown.isIgnoreImages());
  }
}
