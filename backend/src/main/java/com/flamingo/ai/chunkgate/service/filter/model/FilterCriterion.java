package com.flamingo.ai.chunkgate.service.filter.model;

import com.flamingo.ai.chunkgate.domain.enums.CriterionType;

/**
 * Caller-supplied weighted scoring rule.
 *
 * @param type which heuristic evaluates the criterion
 * @param value criterion payload, e.g. a keyword or a collection of keywords
 * @param weight finite multiplier applied to the criterion score; may exceed 1
 * @param mandatory when true, a raw criterion score below 0.5 rejects the chunk
 */
public record FilterCriterion(CriterionType type, Object value, double weight, boolean mandatory) {

  public FilterCriterion {
    if (type == null) {
      throw new IllegalArgumentException("Criterion type is required");
    }
    if (!Double.isFinite(weight)) {
      throw new IllegalArgumentException("Criterion weight must be finite, was " + weight);
    }
  }

  public static FilterCriterion of(CriterionType type) {
    return new FilterCriterion(type, null, 1.0, false);
  }

  public static FilterCriterion of(CriterionType type, Object value) {
    return new FilterCriterion(type, value, 1.0, false);
  }

  public static FilterCriterion of(CriterionType type, Object value, double weight) {
    return new FilterCriterion(type, value, weight, false);
  }

  public static FilterCriterion mandatory(CriterionType type, Object value) {
    return new FilterCriterion(type, value, 1.0, true);
  }
}
