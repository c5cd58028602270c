package com.flamingo.ai.webmarkdown.service.filter;

import com.flamingo.ai.webmarkdown.model.ContentBlock;
import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.FilterResult;
import com.flamingo.ai.webmarkdown.model.NormalizedPage;
import com.flamingo.ai.webmarkdown.model.ThresholdType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Query-free filter that drops navigation, advertising and other boilerplate blocks.
 *
 * <p>Each block gets a composite score from:
 *
 * <ul>
 *   <li>tag weight (prose tags such as {@code p} or {@code article} above {@code div})
 *   <li>link density (anchor text over total text, inverted)
 *   <li>text density (text over markup length)
 *   <li>text length relative to a per-tag baseline, on a log scale
 *   <li>class/id hints: a bonus for content-like names, a penalty for boilerplate-like names
 * </ul>
 *
 * <p>Blocks with fewer than {@code minWordThreshold} words are always dropped. {@link
 * ThresholdType#FIXED} compares the score with the configured threshold. {@link
 * ThresholdType#DYNAMIC} compares it with {@code dynamicMeanFactor × mean score} of the page,
 * adjusted per block for tag importance, text density and link density.
 */
@Service
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class PruningContentFilter implements ContentFilter {

  static final double TAG_WEIGHT = 0.30;
  static final double LINK_WEIGHT = 0.25;
  static final double DENSITY_WEIGHT = 0.15;
  static final double LENGTH_WEIGHT = 0.30;
  static final double POSITIVE_HINT_BONUS = 0.10;
  static final double NEGATIVE_HINT_PENALTY = 0.25;

  private static final double MAX_TAG_WEIGHT = 1.5;
  private static final double DEFAULT_TAG_WEIGHT = 0.6;
  private static final int DEFAULT_BASELINE = 200;

  private static final Map<String, Double> TAG_WEIGHTS =
      Map.ofEntries(
          Map.entry("article", 1.5),
          Map.entry("main", 1.4),
          Map.entry("h1", 1.4),
          Map.entry("section", 1.3),
          Map.entry("h2", 1.3),
          Map.entry("p", 1.2),
          Map.entry("h3", 1.2),
          Map.entry("blockquote", 1.2),
          Map.entry("h4", 1.1),
          Map.entry("pre", 1.1),
          Map.entry("h5", 1.0),
          Map.entry("table", 1.0),
          Map.entry("h6", 0.9),
          Map.entry("ul", 0.8),
          Map.entry("ol", 0.8),
          Map.entry("dl", 0.8),
          Map.entry("div", 0.7),
          Map.entry("span", 0.6),
          Map.entry("li", 0.5));

  /** Text length (chars) at which a block of this tag earns the full length score. */
  private static final Map<String, Integer> LENGTH_BASELINES =
      Map.ofEntries(
          Map.entry("p", 200),
          Map.entry("blockquote", 200),
          Map.entry("article", 800),
          Map.entry("section", 800),
          Map.entry("main", 800),
          Map.entry("div", 400),
          Map.entry("body", 400),
          Map.entry("pre", 300),
          Map.entry("table", 300),
          Map.entry("ul", 200),
          Map.entry("ol", 200),
          Map.entry("li", 80),
          Map.entry("h1", 40),
          Map.entry("h2", 40),
          Map.entry("h3", 40),
          Map.entry("h4", 40),
          Map.entry("h5", 40),
          Map.entry("h6", 40));

  private static final List<String> POSITIVE_HINTS =
      List.of("content", "article", "main", "post", "entry", "text", "body", "story");

  private static final List<String> NEGATIVE_HINTS =
      List.of(
          "nav", "navigation", "footer", "sidebar", "ad", "ads", "advert", "advertisement",
          "comment", "menu", "header", "promo", "banner", "social", "share", "widget", "related",
          "cookie");

  private final ContentBlockExtractor blockExtractor;

  @Override
  public boolean supports(FilterOptions options) {
    return options instanceof FilterOptions.Pruning;
  }

  @Override
  public FilterResult filter(NormalizedPage page, FilterOptions options) {
    FilterOptions.Pruning pruning = (FilterOptions.Pruning) options;
    List<ContentBlock> scored =
        blockExtractor.extract(page).stream().map(b -> b.withScore(score(b))).toList();

    double dynamicBase = dynamicBase(scored, pruning);
    List<ContentBlock> decided = new ArrayList<>(scored.size());
    for (ContentBlock block : scored) {
      decided.add(block.withRetained(keep(block, pruning, dynamicBase)));
    }

    long kept = decided.stream().filter(ContentBlock::retained).count();
    log.debug(
        "Pruning ({}, threshold={}, minWords={}) kept {}/{} blocks",
        pruning.thresholdType(),
        pruning.thresholdType() == ThresholdType.FIXED ? pruning.threshold() : dynamicBase,
        pruning.minWordThreshold(),
        kept,
        decided.size());
    return new FilterResult(options, decided);
  }

  /**
   * Computes the composite score of a block.
   *
   * @param block unscored block
   * @return score, never negative
   */
  double score(ContentBlock block) {
    String tag = block.tagName();
    double tagScore = TAG_WEIGHTS.getOrDefault(tag, DEFAULT_TAG_WEIGHT) / MAX_TAG_WEIGHT;
    double linkScore = 1.0 - block.linkDensity();
    double lengthScore = lengthScore(block.textLength(), tag);

    double score =
        TAG_WEIGHT * tagScore
            + LINK_WEIGHT * linkScore
            + DENSITY_WEIGHT * block.textDensity()
            + LENGTH_WEIGHT * lengthScore;

    List<String> tokens = classIdTokens(block.classAndId());
    if (matchesAny(tokens, POSITIVE_HINTS)) {
      score += POSITIVE_HINT_BONUS;
    }
    if (matchesAny(tokens, NEGATIVE_HINTS)) {
      score -= NEGATIVE_HINT_PENALTY;
    }
    return Math.max(0.0, score);
  }

  // ---- private helpers ----

  private boolean keep(ContentBlock block, FilterOptions.Pruning options, double dynamicBase) {
    if (block.wordCount() < options.minWordThreshold()) {
      return false;
    }
    if (options.thresholdType() == ThresholdType.FIXED) {
      return block.score() >= options.threshold();
    }
    return block.score() >= adjustedThreshold(block, dynamicBase);
  }

  /** Mean score of the blocks that pass the word floor, scaled by the dynamic factor. */
  private double dynamicBase(List<ContentBlock> blocks, FilterOptions.Pruning options) {
    if (options.thresholdType() != ThresholdType.DYNAMIC) {
      return options.threshold();
    }
    double mean =
        blocks.stream()
            .filter(b -> b.wordCount() >= options.minWordThreshold())
            .mapToDouble(ContentBlock::score)
            .average()
            .orElse(0.0);
    return mean * options.dynamicMeanFactor();
  }

  private double adjustedThreshold(ContentBlock block, double base) {
    double threshold = base;
    if (TAG_WEIGHTS.getOrDefault(block.tagName(), DEFAULT_TAG_WEIGHT) > 1.0) {
      threshold *= 0.8;
    }
    if (block.textDensity() > 0.4) {
      threshold *= 0.9;
    }
    if (block.linkDensity() > 0.6) {
      threshold *= 1.2;
    }
    return threshold;
  }

  private static double lengthScore(int textLength, String tag) {
    int baseline = LENGTH_BASELINES.getOrDefault(tag, DEFAULT_BASELINE);
    return Math.min(1.0, Math.log1p(textLength) / Math.log1p(baseline));
  }

  private static List<String> classIdTokens(String classAndId) {
    if (classAndId == null || classAndId.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : classAndId.toLowerCase(Locale.ROOT).split("[\\s_\\-]+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /** Keywords of three or more characters match inside a token; shorter ones must equal it. */
  private static boolean matchesAny(List<String> tokens, List<String> keywords) {
    for (String token : tokens) {
      for (String keyword : keywords) {
        boolean match = keyword.length() >= 3 ? token.contains(keyword) : token.equals(keyword);
        if (match) {
          return true;
        }
      }
    }
    return false;
  }
}
