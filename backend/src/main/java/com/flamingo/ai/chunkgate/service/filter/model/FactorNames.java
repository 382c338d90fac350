package com.flamingo.ai.chunkgate.service.filter.model;

/** Names of the built-in assessment factors. */
public final class FactorNames {

  public static final String CONTENT_RELEVANCE = "Content Relevance";
  public static final String INFORMATION_DENSITY = "Information Density";
  public static final String STRUCTURAL_IMPORTANCE = "Structural Importance";
  public static final String LLM_ASSESSMENT = "LLM Assessment";

  public static final String BIAS_CORRECTION = "Bias Correction";
  public static final String COMPLETENESS_ADJUSTMENT = "Completeness Adjustment";
  public static final String ALTERNATIVE_PERSPECTIVE = "Alternative Perspective";

  public static final String CONSISTENCY_ISSUE = "Consistency Issue";
  public static final String PATTERN_VALIDATION = "Pattern Validation";
  public static final String EDGE_CASE_DETECTION = "Edge Case Detection";

  private FactorNames() {}
}
