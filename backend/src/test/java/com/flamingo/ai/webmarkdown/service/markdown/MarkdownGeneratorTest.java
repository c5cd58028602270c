package com.flamingo.ai.webmarkdown.service.markdown;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.webmarkdown.config.ConversionConfig;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.MarkdownResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import com.flamingo.ai.webmarkdown.model.ThresholdType;
import com.flamingo.ai.webmarkdown.service.filter.Bm25ContentFilter;
import com.flamingo.ai.webmarkdown.service.filter.ContentBlockExtractor;
import com.flamingo.ai.webmarkdown.service.filter.ContentFilterRouter;
import com.flamingo.ai.webmarkdown.service.filter.NoOpContentFilter;
import com.flamingo.ai.webmarkdown.service.filter.PageQueryExtractor;
import com.flamingo.ai.webmarkdown.service.filter.PruningContentFilter;
import com.flamingo.ai.webmarkdown.service.html.HtmlNormalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownGenerator Tests")
class MarkdownGeneratorTest {

  private static final String BASE_URL = "https://example.com/docs/";

  private ConversionConfig config;
  private HtmlNormalizer normalizer;
  private ContentFilterRouter router;
  private MarkdownGenerator generator;

  @BeforeEach
  void setUp() {
    config = new ConversionConfig();
    normalizer = new HtmlNormalizer();
    ContentBlockExtractor extractor = new ContentBlockExtractor();
    router =
        new ContentFilterRouter(
            List.of(
                new NoOpContentFilter(extractor),
                new PruningContentFilter(extractor),
                new Bm25ContentFilter(extractor, new PageQueryExtractor())));
    generator = new MarkdownGenerator(config);
  }

  private MarkdownResult generate(String html, FilterOptions options) {
    NormalizedPage page = normalizer.normalize(html, BASE_URL);
    return generator.generate(page, router.route(options).filter(page, options));
  }

  @Test
  @DisplayName("should take the title from the first h1")
  void shouldTakeTitleFromFirstHeading() {
    String html =
        "<html><head><title>Site name</title></head>"
            + "<body><h1>Article heading</h1><h1>Second</h1><p>Text</p></body></html>";

    assertThat(generate(html, FilterOptions.none()).title()).isEqualTo("Article heading");
  }

  @Test
  @DisplayName("should fall back to the title element and then to no title")
  void shouldFallBackToTitleElement() {
    String withTitle =
        "<html><head><title>Site name</title></head><body><p>Text</p></body></html>";

    assertThat(generate(withTitle, FilterOptions.none()).title()).isEqualTo("Site name");
    assertThat(generate("<body><p>Text</p></body>", FilterOptions.none()).title()).isNull();
  }

  @Test
  @DisplayName("should list a repeated link target once in the references")
  void shouldDeduplicateReferences() {
    String html =
        "<body><p>Visit <a href=\"https://x.com\">X</a> today.</p>"
            + "<p>Again: <a href=\"https://x.com\">X</a>.</p></body>";

    MarkdownResult result = generate(html, FilterOptions.none());

    assertThat(result.rawMarkdown())
        .containsSubsequence("[X](https://x.com)", "[X](https://x.com)");
    assertThat(result.referencesMarkdown()).startsWith("## References");
    assertThat(Arrays.stream(result.referencesMarkdown().split("\n")))
        .filteredOn(line -> line.contains("https://x.com"))
        .containsExactly("[1] [X](https://x.com)");
  }

  @Test
  @DisplayName("should cap the references at the configured maximum")
  void shouldCapReferences() {
    config.getMarkdown().setMaxReferences(2);
    String html =
        "<body><p><a href=\"/a\">A</a> <a href=\"/b\">B</a> <a href=\"/c\">C</a></p></body>";

    MarkdownResult result = generate(html, FilterOptions.none());

    assertThat(result.rawMarkdown()).contains("[C](https://example.com/c)");
    assertThat(result.referencesMarkdown())
        .isEqualTo(
            "## References\n\n[1] [A](https://example.com/a)\n[2] [B](https://example.com/b)");
  }

  @Test
  @DisplayName("should omit references when the page has no links")
  void shouldOmitReferencesWithoutLinks() {
    assertThat(generate("<body><p>Plain</p></body>", FilterOptions.none()).referencesMarkdown())
        .isNull();
  }

  @Test
  @DisplayName("should produce no fit output without a filter")
  void shouldProduceNoFitOutputWithoutFilter() {
    MarkdownResult result = generate("<body><p>One two three</p></body>", FilterOptions.none());

    assertThat(result.rawMarkdown()).isEqualTo("One two three");
    assertThat(result.fitMarkdown()).isNull();
    assertThat(result.fitHtml()).isNull();
    assertThat(result.wordCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("should keep the article and drop the navigation in fit output")
  void shouldPruneNavigationFromFitOutput() {
    String html =
        "<nav>Home About</nav><article><h1>Title</h1>"
            + "<p>Real content here with more than five words.</p></article>";

    MarkdownResult result =
        generate(html, new FilterOptions.Pruning(0.1, ThresholdType.FIXED, 5));

    assertThat(result.fitMarkdown())
        .contains("# Title")
        .contains("Real content here with more than five words.")
        .doesNotContain("Home About");
    assertThat(result.fitHtml()).startsWith("<h1>Title</h1>");
    assertThat(result.wordCount()).isEqualTo(MarkdownResult.countWords(result.fitMarkdown()));
  }

  @Test
  @DisplayName("should produce empty fit output when the filter keeps nothing")
  void shouldProduceEmptyFitOutputWhenNothingRetained() {
    String html = "<body><p>Today's weather forecast calls for rain</p></body>";

    MarkdownResult result = generate(html, new FilterOptions.Bm25("zebra"));

    assertThat(result.fitMarkdown()).isEmpty();
    assertThat(result.fitHtml()).isEmpty();
    assertThat(result.rawMarkdown()).isEqualTo("Today's weather forecast calls for rain");
    assertThat(result.wordCount()).isZero();
  }

  @Test
  @DisplayName("should honor the ignore-links setting")
  void shouldHonorIgnoreLinksSetting() {
    config.getMarkdown().setIgnoreLinks(true);

    MarkdownResult result =
        generate("<body><p>See <a href=\"/guide\">the guide</a></p></body>", FilterOptions.none());

    assertThat(result.rawMarkdown()).isEqualTo("See the guide");
    assertThat(result.referencesMarkdown()).isNull();
  }

  @Test
  @DisplayName("should produce markdown that parses back into the same structure")
  void shouldProduceStructurallyValidMarkdown() {
    String html =
        "<body><h1>Guide</h1><h2>Setup</h2><p>Read the <a href=\"/install\">install notes</a>.</p>"
            + "<ul><li>First</li><li>Second</li></ul><ol><li>Step</li></ol>"
            + "<pre><code class=\"language-bash\">mvn -B test\n</code></pre></body>";

    String markdown = generate(html, FilterOptions.none()).rawMarkdown();
    Node document = Parser.builder().build().parse(markdown);
    StructureCollector structure = new StructureCollector();
    document.accept(structure);

    assertThat(structure.headingLevels).containsExactly(1, 2);
    assertThat(structure.bulletLists).isEqualTo(1);
    assertThat(structure.orderedLists).isEqualTo(1);
    assertThat(structure.linkDestinations).containsExactly("https://example.com/install");
    assertThat(structure.codeInfo).containsExactly("bash");
    assertThat(structure.codeLiterals).containsExactly("mvn -B test\n");
  }

  private static final class StructureCollector extends AbstractVisitor {

    private final List<Integer> headingLevels = new ArrayList<>();
    private final List<String> linkDestinations = new ArrayList<>();
    private final List<String> codeInfo = new ArrayList<>();
    private final List<String> codeLiterals = new ArrayList<>();
    private int bulletLists;
    private int orderedLists;

    @Override
    public void visit(Heading heading) {
      headingLevels.add(heading.getLevel());
      visitChildren(heading);
    }

    @Override
    public void visit(BulletList bulletList) {
      bulletLists++;
      visitChildren(bulletList);
    }

    @Override
    public void visit(OrderedList orderedList) {
      orderedLists++;
      visitChildren(orderedList);
    }

    @Override
    public void visit(Link link) {
      linkDestinations.add(link.getDestination());
      visitChildren(link);
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      codeInfo.add(codeBlock.getInfo());
      codeLiterals.add(codeBlock.getLiteral());
    }
  }
}
