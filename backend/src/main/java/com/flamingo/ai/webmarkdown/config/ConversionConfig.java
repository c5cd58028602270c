package com.flamingo.ai.webmarkdown.config;

import com.flamingo.ai.webmarkdown.model.FilterOptions;
import com.flamingo.ai.webmarkdown.model.ThresholdType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the HTML-to-Markdown pipeline. */
@Configuration
@ConfigurationProperties(prefix = "conversion")
@Getter
@Setter
public class ConversionConfig {

  private Pruning pruning = new Pruning();
  private Bm25 bm25 = new Bm25();
  private Markdown markdown = new Markdown();

  /** Defaults for the pruning filter when a caller asks for pruning without parameters. */
  @Getter
  @Setter
  public static class Pruning {
    private double threshold = FilterOptions.Pruning.DEFAULT_THRESHOLD;
    private ThresholdType thresholdType = ThresholdType.DYNAMIC;
    private int minWordThreshold = FilterOptions.Pruning.DEFAULT_MIN_WORD_THRESHOLD;

    /** Fraction of the page's mean block score used as the dynamic cut-off. */
    private double dynamicMeanFactor = FilterOptions.Pruning.DEFAULT_DYNAMIC_MEAN_FACTOR;

    public FilterOptions.Pruning toOptions() {
      return new FilterOptions.Pruning(
          threshold, thresholdType, minWordThreshold, dynamicMeanFactor);
    }
  }

  @Getter
  @Setter
  public static class Bm25 {
    private double threshold = FilterOptions.Bm25.DEFAULT_THRESHOLD;
    private double k1 = FilterOptions.Bm25.DEFAULT_K1;
    private double b = FilterOptions.Bm25.DEFAULT_B;

    /** Blocks kept when no block reaches the threshold. */
    private int fallbackTopN = FilterOptions.Bm25.DEFAULT_FALLBACK_TOP_N;

    public FilterOptions.Bm25 toOptions(String query) {
      return new FilterOptions.Bm25(query, threshold, k1, b, fallbackTopN);
    }
  }

  @Getter
  @Setter
  public static class Markdown {
    /** Render anchors as plain text and skip citation bookkeeping. */
    private boolean ignoreLinks = false;

    /** Drop images from the output. */
    private boolean ignoreImages = false;

    /** Citations listed in the references section; zero or less lists all of them. */
    private int maxReferences = 50;
  }
}
