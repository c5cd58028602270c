package com.flamingo.ai.webmarkdown.model;

/** How the pruning filter turns block scores into a retain/drop decision. */
public enum ThresholdType {
  /** Blocks scoring below the configured threshold are dropped. */
  FIXED,

  /** The cut-off is derived per page from the observed score distribution. */
  DYNAMIC
}
