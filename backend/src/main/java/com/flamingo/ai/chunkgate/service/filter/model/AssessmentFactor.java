package com.flamingo.ai.chunkgate.service.filter.model;

/**
 * A single named, signed contribution to a chunk score. Contributions are not bounded to [0, 1];
 * negative values are penalties.
 */
public record AssessmentFactor(String name, double contribution, String explanation) {

  public AssessmentFactor {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Factor name is required");
    }
    explanation = explanation == null ? "" : explanation;
  }

  /**
   * Combines this factor with a same-named factor from a later stage: contributions are averaged
   * and explanations joined with {@code " | "}.
   */
  public AssessmentFactor mergedWith(AssessmentFactor later) {
    return new AssessmentFactor(
        name,
        (contribution + later.contribution()) / 2,
        explanation + " | " + later.explanation());
  }
}
