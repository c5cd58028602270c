package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Query-driven filter: keeps the blocks most relevant to a query under Okapi BM25.
 *
 * <p>Every block of the page is one document of the corpus, so inverse document frequency is
 * page-local. Blocks scoring at least {@code threshold} are kept. When none does, the {@code
 * fallbackTopN} best blocks with a positive score are kept instead, so a weakly matching page
 * still yields its most relevant passages. A page without a single matching term keeps nothing.
 *
 * <p>A blank query is replaced by one derived from page metadata via {@link PageQueryExtractor}.
 */
@Service
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class Bm25ContentFilter implements ContentFilter {

  private final ContentBlockExtractor blockExtractor;
  private final PageQueryExtractor queryExtractor;

  @Override
  public boolean supports(FilterOptions options) {
    return options instanceof FilterOptions.Bm25;
  }

  @Override
  public FilterResult filter(NormalizedPage page, FilterOptions options) {
    FilterOptions.Bm25 bm25 = (FilterOptions.Bm25) options;
    List<ContentBlock> blocks = blockExtractor.extract(page);

    String query = bm25.query().isBlank() ? queryExtractor.extract(page) : bm25.query();
    List<String> queryTokens = TextTokenizer.tokenize(query);
    if (blocks.isEmpty() || queryTokens.isEmpty()) {
      log.debug("BM25 skipped: {} blocks, query tokens={}", blocks.size(), queryTokens);
      return new FilterResult(options, blocks);
    }

    List<List<String>> corpus =
        blocks.stream().map(b -> TextTokenizer.tokenize(b.text())).toList();
    double[] scores = new Bm25Scorer(corpus, bm25.k1(), bm25.b()).scores(queryTokens);

    List<ContentBlock> scored = new ArrayList<>(blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      scored.add(blocks.get(i).withScore(scores[i]));
    }

    Set<Integer> keep = new HashSet<>();
    for (ContentBlock block : scored) {
      if (block.score() >= bm25.threshold()) {
        keep.add(block.index());
      }
    }
    if (keep.isEmpty()) {
      keep.addAll(fallback(scored, bm25.fallbackTopN()));
      log.debug(
          "No block reached BM25 threshold {}; fallback kept {} blocks",
          bm25.threshold(),
          keep.size());
    }

    List<ContentBlock> decided =
        scored.stream().map(b -> b.withRetained(keep.contains(b.index()))).toList();
    log.debug("BM25 query='{}' kept {}/{} blocks", query, keep.size(), decided.size());
    return new FilterResult(options, decided);
  }

  /** Indices of the {@code topN} best positively scored blocks; ties go to the earlier block. */
  private static List<Integer> fallback(List<ContentBlock> scored, int topN) {
    return scored.stream()
        .filter(b -> b.score() > 0.0)
        .sorted(
            Comparator.comparingDouble(ContentBlock::score)
                .reversed()
                .thenComparingInt(ContentBlock::index))
        .limit(topN)
        .map(ContentBlock::index)
        .toList();
  }
}
