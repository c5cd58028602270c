package com.flamingo.ai.webmarkdown.model;

/**
 * Selects the content filter applied before fit-Markdown generation.
 *
 * <p>Closed set of variants: {@link None}, {@link Pruning} and {@link Bm25}. Parameters outside
 * their valid range are clamped to the nearest valid bound when the record is constructed, so a
 * caller can never produce an invalid option value.
 */
public sealed interface FilterOptions
    permits FilterOptions.None, FilterOptions.Pruning, FilterOptions.Bm25 {

  /** Short name used in logs and metric tags. */
  String name();

  /** Returns the shared no-filter option. */
  static FilterOptions none() {
    return None.INSTANCE;
  }

  /** No filtering: all blocks are kept and no fit output is produced. */
  record None() implements FilterOptions {

    static final None INSTANCE = new None();

    @Override
    public String name() {
      return "none";
    }
  }

  /**
   * Query-free heuristic filter that drops boilerplate blocks.
   *
   * @param threshold fixed cut-off score, used in {@link ThresholdType#FIXED} mode
   * @param thresholdType fixed or page-relative cut-off
   * @param minWordThreshold blocks with fewer words are always dropped
   * @param dynamicMeanFactor fraction of the page's mean score used as the base cut-off in {@link
   *     ThresholdType#DYNAMIC} mode
   */
  record Pruning(
      double threshold,
      ThresholdType thresholdType,
      int minWordThreshold,
      double dynamicMeanFactor)
      implements FilterOptions {

    public static final double DEFAULT_THRESHOLD = 0.48;
    public static final int DEFAULT_MIN_WORD_THRESHOLD = 5;
    public static final double DEFAULT_DYNAMIC_MEAN_FACTOR = 0.8;

    public Pruning {
      threshold = Double.isNaN(threshold) ? DEFAULT_THRESHOLD : Math.max(0.0, threshold);
      thresholdType = thresholdType != null ? thresholdType : ThresholdType.FIXED;
      minWordThreshold = Math.max(0, minWordThreshold);
      dynamicMeanFactor =
          Double.isNaN(dynamicMeanFactor)
              ? DEFAULT_DYNAMIC_MEAN_FACTOR
              : Math.min(2.0, Math.max(0.0, dynamicMeanFactor));
    }

    public Pruning(double threshold, ThresholdType thresholdType, int minWordThreshold) {
      this(threshold, thresholdType, minWordThreshold, DEFAULT_DYNAMIC_MEAN_FACTOR);
    }

    @Override
    public String name() {
      return "pruning";
    }
  }

  /**
   * Query-driven relevance filter scoring each block with Okapi BM25.
   *
   * @param query search query; blank means "derive from page metadata"
   * @param threshold minimum score for a block to be kept
   * @param k1 term-frequency saturation
   * @param b block-length normalization
   * @param fallbackTopN number of best blocks kept when none reaches {@code threshold}
   */
  record Bm25(String query, double threshold, double k1, double b, int fallbackTopN)
      implements FilterOptions {

    public static final double DEFAULT_THRESHOLD = 1.0;
    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;
    public static final int DEFAULT_FALLBACK_TOP_N = 3;

    public Bm25 {
      query = query != null ? query : "";
      threshold = Double.isNaN(threshold) ? DEFAULT_THRESHOLD : Math.max(0.0, threshold);
      k1 = Double.isNaN(k1) ? DEFAULT_K1 : Math.max(0.0, k1);
      b = Double.isNaN(b) ? DEFAULT_B : Math.min(1.0, Math.max(0.0, b));
      fallbackTopN = Math.max(0, fallbackTopN);
    }

    public Bm25(String query, double threshold) {
      this(query, threshold, DEFAULT_K1, DEFAULT_B, DEFAULT_FALLBACK_TOP_N);
    }

    public Bm25(String query) {
      this(query, DEFAULT_THRESHOLD);
    }

    @Override
    public String name() {
      return "bm25";
    }
  }
}
