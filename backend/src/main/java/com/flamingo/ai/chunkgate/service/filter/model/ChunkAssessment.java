package com.flamingo.ai.chunkgate.service.filter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of the three-stage assessment of one chunk.
 *
 * <p>{@code reflectionScore} is non-null exactly when self-reflection ran, {@code criticScore}
 * exactly when critic validation ran, and {@link #reasoning()} carries a key for every stage that
 * ran.
 */
public record ChunkAssessment(
    double initialScore,
    Double reflectionScore,
    Double criticScore,
    double finalScore,
    double confidence,
    List<AssessmentFactor> factors,
    List<String> suggestions,
    Map<String, String> reasoning) {

  public static final String STAGE_INITIAL = "initial";
  public static final String STAGE_REFLECTION = "reflection";
  public static final String STAGE_CRITIC = "critic";

  public ChunkAssessment {
    factors = factors == null ? List.of() : List.copyOf(factors);
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    reasoning =
        reasoning == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(reasoning));
  }

  /** First factor with the given name, if any. */
  public Optional<AssessmentFactor> findFactor(String name) {
    return factors.stream().filter(factor -> factor.name().equals(name)).findFirst();
  }
}
