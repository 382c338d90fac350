package com.flamingo.ai.chunkgate.service.filter.assessment;

import com.flamingo.ai.chunkgate.service.filter.heuristic.ChunkHeuristics;
import com.flamingo.ai.chunkgate.service.filter.model.AssessmentFactor;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FactorNames;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Combines stage scores and factors into final, confidence, quality and combined scores. */
@Component
public class ScoreComposer {

  static final double INITIAL_WEIGHT = 0.4;
  static final double REFLECTION_WEIGHT = 0.3;
  static final double CRITIC_WEIGHT = 0.3;

  static final String REFINE_BOUNDARIES =
      "Consider refining chunk boundaries to capture more complete context";
  static final String LOW_DENSITY =
      "Low information density - consider merging with adjacent chunks";
  static final String EDGE_CASE = "Edge case detected - review chunk extraction logic";

  /**
   * Weighted mean of the stage scores that ran, re-normalised over the weights actually used.
   *
   * @param initial stage-1 score
   * @param reflection stage-2 score, null when skipped
   * @param critic stage-3 score, null when skipped
   * @return final score in [0, 1]
   */
  public double finalScore(double initial, Double reflection, Double critic) {
    double weighted = initial * INITIAL_WEIGHT;
    double totalWeight = INITIAL_WEIGHT;
    if (reflection != null) {
      weighted += reflection * REFLECTION_WEIGHT;
      totalWeight += REFLECTION_WEIGHT;
    }
    if (critic != null) {
      weighted += critic * CRITIC_WEIGHT;
      totalWeight += CRITIC_WEIGHT;
    }
    return ChunkHeuristics.clamp(weighted / totalWeight);
  }

  /**
   * Blend of stage agreement (50%), factor count (30%) and how far the mean stage score sits from
   * 0.5 (20%).
   */
  public double confidence(double initial, Double reflection, Double critic, int factorCount) {
    List<Double> stageScores = new ArrayList<>();
    stageScores.add(initial);
    if (reflection != null) {
      stageScores.add(reflection);
    }
    if (critic != null) {
      stageScores.add(critic);
    }
    double[] values = stageScores.stream().mapToDouble(Double::doubleValue).toArray();

    double mean = Arrays.stream(values).average().orElse(initial);
    double consistency = Math.max(0.0, 1 - variance(values) * 2);
    double factorDiversity = Math.min(1.0, factorCount / 10.0);
    double extremity = Math.abs(mean - 0.5) * 2;

    return ChunkHeuristics.clamp(consistency * 0.5 + factorDiversity * 0.3 + extremity * 0.2);
  }

  /** Quality from the density and completeness factors, starting at 0.5. */
  public double qualityScore(ChunkAssessment assessment) {
    double quality = 0.5;

    Optional<AssessmentFactor> density = assessment.findFactor(FactorNames.INFORMATION_DENSITY);
    if (density.isPresent()) {
      quality = Math.max(quality, density.get().contribution() + 0.5);
    }

    Optional<AssessmentFactor> completeness =
        assessment.findFactor(FactorNames.COMPLETENESS_ADJUSTMENT);
    if (completeness.isPresent()) {
      quality += completeness.get().contribution() * 0.5;
    }
    return ChunkHeuristics.clamp(quality);
  }

  public double combinedScore(double relevance, double quality, double qualityWeight) {
    return ChunkHeuristics.clamp(relevance * (1 - qualityWeight) + quality * qualityWeight);
  }

  public List<String> suggestions(double finalScore, List<AssessmentFactor> factors) {
    List<String> suggestions = new ArrayList<>();

    if (finalScore < 0.5) {
      suggestions.add(REFINE_BOUNDARIES);
    }
    if (firstNamed(factors, FactorNames.INFORMATION_DENSITY)
        .filter(factor -> factor.contribution() < 0.3)
        .isPresent()) {
      suggestions.add(LOW_DENSITY);
    }
    if (firstNamed(factors, FactorNames.EDGE_CASE_DETECTION)
        .filter(factor -> factor.contribution() < -0.1)
        .isPresent()) {
      suggestions.add(EDGE_CASE);
    }
    return suggestions;
  }

  /**
   * Short summary of the filtering decision.
   *
   * @param assessment the chunk assessment
   * @param passed the decision
   * @param combinedScore the score compared against the threshold
   * @param minRelevanceScore the threshold
   * @param failedMandatory mandatory criterion that rejected the chunk, if any
   * @return comma-separated reason parts
   */
  public String reason(
      ChunkAssessment assessment,
      boolean passed,
      double combinedScore,
      double minRelevanceScore,
      Optional<FilterCriterion> failedMandatory) {
    List<String> reasons = new ArrayList<>();
    List<AssessmentFactor> factors = assessment.factors();

    if (passed) {
      reasons.add("Relevance: " + format(assessment.finalScore()));
      factors.stream()
          .max(Comparator.comparingDouble(factor -> Math.abs(factor.contribution())))
          .ifPresent(top -> reasons.add("Key factor: " + top.name()));
    } else {
      failedMandatory.ifPresent(
          criterion ->
              reasons.add("Mandatory criterion not met: " + criterion.type().getDisplayName()));
      if (combinedScore < minRelevanceScore) {
        reasons.add("Below threshold (" + format(minRelevanceScore) + ")");
      }
      factors.stream()
          .min(Comparator.comparingDouble(AssessmentFactor::contribution))
          .ifPresent(worst -> reasons.add("Issue: " + worst.name()));
    }

    if (assessment.confidence() < 0.5) {
      reasons.add("Low confidence assessment");
    }
    return String.join(", ", reasons);
  }

  /** Population variance; 0 for an empty array. */
  static double variance(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double mean = Arrays.stream(values).average().orElse(0.0);
    return Arrays.stream(values).map(v -> (v - mean) * (v - mean)).average().orElse(0.0);
  }

  private static Optional<AssessmentFactor> firstNamed(
      List<AssessmentFactor> factors, String name) {
    return factors.stream().filter(factor -> factor.name().equals(name)).findFirst();
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
