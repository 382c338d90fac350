package com.flamingo.ai.chunkgate.service.filter.assessment;

import static com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment.STAGE_CRITIC;
import static com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment.STAGE_INITIAL;
import static com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment.STAGE_REFLECTION;

import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import com.flamingo.ai.chunkgate.service.filter.heuristic.ChunkHeuristics;
import com.flamingo.ai.chunkgate.service.filter.heuristic.CriterionEvaluator;
import com.flamingo.ai.chunkgate.service.filter.model.AssessmentFactor;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FactorNames;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores a chunk in three stages.
 *
 * <ol>
 *   <li>Initial assessment: heuristics, caller criteria and, when a query is given, the
 *       language-model relevance probe.
 *   <li>Self-reflection (optional): corrects for factor concentration, incomplete sentences and a
 *       diverging alternative relevance estimate.
 *   <li>Critic validation (optional): penalises inconsistent factors and degenerate text.
 * </ol>
 *
 * <p>Each call builds fresh value objects; the assessor holds no per-call state and is safe to use
 * from concurrent batch workers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThreeStageAssessor {

  private static final double BIAS_THRESHOLD = 0.7;
  private static final double COMPLETENESS_THRESHOLD = 0.7;
  private static final double ALTERNATIVE_DIVERGENCE = 0.2;
  private static final double CONSISTENCY_THRESHOLD = 0.8;

  private final RelevanceProbe relevanceProbe;
  private final CriterionEvaluator criterionEvaluator;
  private final ScoreComposer scoreComposer;

  /**
   * Runs the enabled stages and composes the final assessment.
   *
   * @param chunk the chunk to assess
   * @param query the query, may be null for quality-only assessment
   * @param options stage toggles and criteria
   * @param cancellation forwarded to the relevance probe
   * @return the assessment
   */
  public ChunkAssessment assess(
      Chunk chunk, String query, ChunkFilteringOptions options, CancellationSignal cancellation) {
    Map<String, String> reasoning = new LinkedHashMap<>();

    StageResult initial = initialAssessment(chunk, query, options.getCriteria(), cancellation);
    reasoning.put(STAGE_INITIAL, initial.reasoning());
    List<AssessmentFactor> factors = initial.factors();

    Double reflectionScore = null;
    if (options.isUseSelfReflection()) {
      StageResult reflection = selfReflection(chunk, query, initial.score(), initial.factors());
      reflectionScore = reflection.score();
      reasoning.put(STAGE_REFLECTION, reflection.reasoning());
      factors = AssessmentFactors.merge(factors, reflection.factors());
    }

    Double criticScore = null;
    if (options.isUseCriticValidation()) {
      double previousScore = reflectionScore != null ? reflectionScore : initial.score();
      StageResult critic = criticValidation(chunk, previousScore, factors);
      criticScore = critic.score();
      reasoning.put(STAGE_CRITIC, critic.reasoning());
      factors = AssessmentFactors.merge(factors, critic.factors());
    }

    double finalScore = scoreComposer.finalScore(initial.score(), reflectionScore, criticScore);
    double confidence =
        scoreComposer.confidence(initial.score(), reflectionScore, criticScore, factors.size());

    log.debug(
        "Assessed chunk {}: initial={}, reflection={}, critic={}, final={}",
        chunk.id(),
        format(initial.score()),
        reflectionScore == null ? "skipped" : format(reflectionScore),
        criticScore == null ? "skipped" : format(criticScore),
        format(finalScore));

    return new ChunkAssessment(
        initial.score(),
        reflectionScore,
        criticScore,
        finalScore,
        confidence,
        factors,
        scoreComposer.suggestions(finalScore, factors),
        reasoning);
  }

  StageResult initialAssessment(
      Chunk chunk, String query, List<FilterCriterion> criteria, CancellationSignal cancellation) {
    List<AssessmentFactor> factors = new ArrayList<>();
    List<Double> scores = new ArrayList<>();
    String content = chunk.content();

    double relevance = ChunkHeuristics.contentRelevance(content, query);
    factors.add(
        new AssessmentFactor(
            FactorNames.CONTENT_RELEVANCE,
            relevance,
            "Content alignment with query: " + format(relevance)));
    scores.add(relevance);

    double density = ChunkHeuristics.informationDensity(content);
    factors.add(
        new AssessmentFactor(
            FactorNames.INFORMATION_DENSITY,
            density * 0.5,
            "Information richness: " + format(density)));
    scores.add(density);

    double structural = ChunkHeuristics.structuralImportance(chunk);
    factors.add(
        new AssessmentFactor(
            FactorNames.STRUCTURAL_IMPORTANCE,
            structural * 0.3,
            "Document structure relevance: " + format(structural)));
    scores.add(structural);

    for (FilterCriterion criterion : criteria) {
      double raw = criterionEvaluator.evaluate(chunk, query, criterion);
      double weighted = raw * criterion.weight();
      factors.add(
          new AssessmentFactor(
              criterion.type().getDisplayName(),
              weighted,
              String.format(
                  Locale.ROOT,
                  "Criterion %s: %.2f (raw %.2f, weight %.2f)",
                  criterion.type().getDisplayName(),
                  weighted,
                  raw,
                  criterion.weight())));
      scores.add(weighted);
    }

    if (ChunkHeuristics.hasQuery(query)) {
      ProbeResult probe = relevanceProbe.probe(chunk, query, cancellation);
      String explanation = "LLM relevance assessment: " + format(probe.score());
      if (probe.isFallback()) {
        explanation += " (heuristic fallback)";
      }
      factors.add(
          new AssessmentFactor(FactorNames.LLM_ASSESSMENT, probe.score() * 0.8, explanation));
      scores.add(probe.score());
    }

    double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.5);
    double score = ChunkHeuristics.clamp(mean);
    AssessmentFactor primary =
        factors.stream()
            .max(Comparator.comparingDouble(factor -> Math.abs(factor.contribution())))
            .orElseThrow();
    String reasoning =
        "Initial assessment based on "
            + factors.size()
            + " factors. Primary factor: "
            + primary.name();

    return new StageResult(score, reasoning, factors);
  }

  StageResult selfReflection(
      Chunk chunk, String query, double initialScore, List<AssessmentFactor> initialFactors) {
    List<AssessmentFactor> factors = new ArrayList<>();

    double concentration = concentration(initialFactors);
    if (concentration > BIAS_THRESHOLD) {
      double correction = (concentration - BIAS_THRESHOLD) * 0.5;
      factors.add(
          new AssessmentFactor(
              FactorNames.BIAS_CORRECTION,
              -correction,
              "Correcting for assessment bias: " + format(correction)));
    }

    double completeness = ChunkHeuristics.completeness(chunk.content());
    if (completeness < COMPLETENESS_THRESHOLD) {
      factors.add(
          new AssessmentFactor(
              FactorNames.COMPLETENESS_ADJUSTMENT,
              (completeness - COMPLETENESS_THRESHOLD) * 0.5,
              "Adjusting for incomplete coverage: " + format(completeness)));
    }

    double alternative = alternativePerspective(chunk.content(), query);
    if (Math.abs(alternative - initialScore) > ALTERNATIVE_DIVERGENCE) {
      factors.add(
          new AssessmentFactor(
              FactorNames.ALTERNATIVE_PERSPECTIVE,
              (alternative - initialScore) * 0.3,
              "Alternative view suggests: " + format(alternative)));
    }

    double reflected = ChunkHeuristics.clamp(initialScore + sumContributions(factors));
    String reasoning =
        "Self-reflection identified "
            + factors.size()
            + " adjustments. Score adjusted from "
            + format(initialScore)
            + " to "
            + format(reflected);

    return new StageResult(reflected, reasoning, factors);
  }

  StageResult criticValidation(
      Chunk chunk, double previousScore, List<AssessmentFactor> existingFactors) {
    List<AssessmentFactor> factors = new ArrayList<>();
    String content = chunk.content();

    double consistency = consistency(existingFactors);
    if (consistency < CONSISTENCY_THRESHOLD) {
      factors.add(
          new AssessmentFactor(
              FactorNames.CONSISTENCY_ISSUE,
              (consistency - 1) * 0.3,
              "Inconsistency detected: " + format(consistency)));
    }

    double validation = ChunkHeuristics.patternValidation(content);
    factors.add(
        new AssessmentFactor(
            FactorNames.PATTERN_VALIDATION,
            (validation - 0.5) * 0.5,
            "Pattern matching validation: " + format(validation)));

    double edgeCase = ChunkHeuristics.edgeCaseAdjustment(content);
    if (edgeCase != 0.0) {
      factors.add(
          new AssessmentFactor(
              FactorNames.EDGE_CASE_DETECTION,
              edgeCase,
              "Edge case adjustment: " + format(edgeCase)));
    }

    double criticScore = ChunkHeuristics.clamp(previousScore + sumContributions(factors));
    String reasoning =
        "Critic validation performed "
            + factors.size()
            + " checks. Final validation score: "
            + format(criticScore);

    return new StageResult(criticScore, reasoning, factors);
  }

  /** Share of the largest absolute contribution in the total; 0 when there is nothing to share. */
  static double concentration(List<AssessmentFactor> factors) {
    double max = 0.0;
    double total = 0.0;
    for (AssessmentFactor factor : factors) {
      double magnitude = Math.abs(factor.contribution());
      max = Math.max(max, magnitude);
      total += magnitude;
    }
    return total == 0.0 ? 0.0 : max / total;
  }

  /** {@code 1 - 2 * variance} of the contributions, floored at 0; 1 for fewer than two factors. */
  static double consistency(List<AssessmentFactor> factors) {
    if (factors.size() < 2) {
      return 1.0;
    }
    double[] contributions =
        factors.stream().mapToDouble(AssessmentFactor::contribution).toArray();
    return Math.max(0.0, 1 - ScoreComposer.variance(contributions) * 2);
  }

  private static double sumContributions(List<AssessmentFactor> factors) {
    return factors.stream().mapToDouble(AssessmentFactor::contribution).sum();
  }

  private static double alternativePerspective(String content, String query) {
    double direct = ChunkHeuristics.contentRelevance(content, query);
    if (direct < 0.2) {
      return 0.3;
    }
    return direct;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
