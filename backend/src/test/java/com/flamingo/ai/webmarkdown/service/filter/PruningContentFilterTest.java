package com.flamingo.ai.webmarkdown.service.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.ThresholdType;
import com.flamingo.ai.webmarkdown.service.html.HtmlNormalizer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PruningContentFilter Tests")
class PruningContentFilterTest {

  private static final String LONG_SENTENCE =
      "The committee published a detailed report on regional water supplies, covering rainfall,"
          + " reservoir levels and the expected demand over the next decade in every district.";

  private HtmlNormalizer normalizer;
  private ContentBlockExtractor extractor;
  private PruningContentFilter filter;

  @BeforeEach
  void setUp() {
    normalizer = new HtmlNormalizer();
    extractor = new ContentBlockExtractor();
    filter = new PruningContentFilter(extractor);
  }

  private FilterResult prune(String html, FilterOptions.Pruning options) {
    return filter.filter(normalizer.normalize(html, "https://example.com"), options);
  }

  @Test
  @DisplayName("should support only pruning options")
  void shouldSupportOnlyPruningOptions() {
    assertThat(filter.supports(new FilterOptions.Pruning(0.5, ThresholdType.FIXED, 5))).isTrue();
    assertThat(filter.supports(FilterOptions.none())).isFalse();
    assertThat(filter.supports(new FilterOptions.Bm25("q"))).isFalse();
  }

  @Test
  @DisplayName("should drop every block below the word floor")
  void shouldDropBlocksBelowWordFloor() {
    String html = "<body><p>Too short here</p><p>" + LONG_SENTENCE + "</p></body>";

    FilterResult result = prune(html, new FilterOptions.Pruning(0.0, ThresholdType.FIXED, 5));

    assertThat(result.blocks()).hasSize(2);
    assertThat(result.retained()).hasSize(1);
    assertThat(result.retained().get(0).text()).isEqualTo(LONG_SENTENCE);
    assertThat(result.retained()).allMatch(b -> b.wordCount() >= 5);
  }

  @Test
  @DisplayName("should keep article content and drop link-heavy navigation with a fixed threshold")
  void shouldDropNavigationWithFixedThreshold() {
    String html =
        "<body><div><a href=\"/1\">one</a> <a href=\"/2\">two</a> <a href=\"/3\">three</a>"
            + " <a href=\"/4\">four</a> <a href=\"/5\">five</a></div><p>"
            + LONG_SENTENCE
            + "</p></body>";

    FilterResult result = prune(html, new FilterOptions.Pruning(0.48, ThresholdType.FIXED, 5));

    assertThat(result.retained()).extracting(ContentBlock::text).containsExactly(LONG_SENTENCE);
  }

  @Test
  @DisplayName("should penalize blocks whose class names look like boilerplate")
  void shouldPenalizeNegativeClassHints() {
    String html =
        "<body><p class=\"footer-links\">"
            + LONG_SENTENCE
            + "</p><p>"
            + LONG_SENTENCE
            + "</p></body>";

    List<ContentBlock> blocks = extractor.extract(normalizer.normalize(html, ""));
    double penalized = filter.score(blocks.get(0));
    double plain = filter.score(blocks.get(1));

    assertThat(penalized).isLessThan(plain - 0.2);
  }

  @Test
  @DisplayName("should penalize paragraphs inside a boilerplate-classed container")
  void shouldPenalizeParagraphsInsideBoilerplateContainer() {
    String html =
        "<body><div class=\"comments\"><p>"
            + LONG_SENTENCE
            + "</p></div><p>"
            + LONG_SENTENCE
            + "</p></body>";

    List<ContentBlock> blocks = extractor.extract(normalizer.normalize(html, ""));
    double inComments = filter.score(blocks.get(0));
    double plain = filter.score(blocks.get(1));

    assertThat(inComments)
        .isCloseTo(plain - PruningContentFilter.NEGATIVE_HINT_PENALTY, within(1e-9));

    FilterResult result =
        prune(html, new FilterOptions.Pruning(plain - 0.1, ThresholdType.FIXED, 5));

    assertThat(result.retained()).extracting(ContentBlock::index).containsExactly(1);
  }

  @Test
  @DisplayName("should reward blocks whose class names look like content")
  void shouldRewardPositiveClassHints() {
    String html =
        "<body><p class=\"post-body\">" + LONG_SENTENCE + "</p><p>" + LONG_SENTENCE + "</p></body>";

    List<ContentBlock> blocks = extractor.extract(normalizer.normalize(html, ""));

    assertThat(filter.score(blocks.get(0))).isGreaterThan(filter.score(blocks.get(1)));
  }

  @Test
  @DisplayName("should retain similar proportions on low and high scoring pages in dynamic mode")
  void shouldRetainSimilarProportionsInDynamicMode() {
    String lowBlock = "<div><a href=\"/a\">one two three four five six</a></div>";
    String highBlock = "<p>" + LONG_SENTENCE + "</p>";
    String lowPage = "<body>" + lowBlock.repeat(4) + "</body>";
    String highPage = "<body>" + highBlock.repeat(4) + "</body>";

    FilterOptions.Pruning dynamic = new FilterOptions.Pruning(0.48, ThresholdType.DYNAMIC, 5);
    FilterOptions.Pruning fixed = new FilterOptions.Pruning(0.48, ThresholdType.FIXED, 5);

    assertThat(prune(lowPage, dynamic).retained()).hasSize(4);
    assertThat(prune(highPage, dynamic).retained()).hasSize(4);

    assertThat(prune(lowPage, fixed).retained()).isEmpty();
    assertThat(prune(highPage, fixed).retained()).hasSize(4);
  }

  @Test
  @DisplayName("should keep the title and paragraph of an article while dropping the nav")
  void shouldKeepArticleWhileDroppingNav() {
    String html =
        "<nav>Home About</nav><article><h1>Title</h1>"
            + "<p>Real content here with more than five words.</p></article>";

    FilterResult result = prune(html, new FilterOptions.Pruning(0.1, ThresholdType.FIXED, 5));

    assertThat(result.retained()).hasSize(1);
    assertThat(result.retained().get(0).text()).contains("Title").doesNotContain("Home About");
  }

  @Test
  @DisplayName("should never produce a negative score")
  void shouldNeverProduceNegativeScore() {
    String html = "<body><div class=\"nav-ad-banner\"><a href=\"/x\">x</a></div></body>";

    List<ContentBlock> blocks = extractor.extract(normalizer.normalize(html, ""));

    assertThat(blocks).isNotEmpty();
    assertThat(filter.score(blocks.get(0))).isGreaterThanOrEqualTo(0.0);
  }
}
