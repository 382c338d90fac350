package com.flamingo.ai.chunkgate.service.filter.assessment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.domain.enums.CriterionType;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import com.flamingo.ai.chunkgate.service.filter.heuristic.CriterionEvaluator;
import com.flamingo.ai.chunkgate.service.filter.model.AssessmentFactor;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FactorNames;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ThreeStageAssessor Tests")
class ThreeStageAssessorTest {

  private static final String ML_TEXT =
      "Machine learning models learn patterns from training data. Supervised learning uses"
          + " labelled examples to fit a function that generalises to unseen inputs.";

  private static final ChunkFilteringOptions INITIAL_ONLY =
      ChunkFilteringOptions.builder().useSelfReflection(false).useCriticValidation(false).build();

  @Mock private RelevanceProbe relevanceProbe;

  private ThreeStageAssessor assessor;

  @BeforeEach
  void setUp() {
    assessor =
        new ThreeStageAssessor(
            relevanceProbe, new CriterionEvaluator(Clock.systemUTC()), new ScoreComposer());
  }

  @Nested
  @DisplayName("Initial assessment")
  class InitialAssessment {

    @Test
    @DisplayName("Should skip the probe without a query")
    void shouldSkipProbeWithoutQuery() {
      ChunkAssessment assessment =
          assessor.assess(new Chunk("c1", ML_TEXT), null, INITIAL_ONLY, CancellationSignal.none());

      assertThat(assessment.factors())
          .extracting(AssessmentFactor::name)
          .containsExactly(
              FactorNames.CONTENT_RELEVANCE,
              FactorNames.INFORMATION_DENSITY,
              FactorNames.STRUCTURAL_IMPORTANCE);
      assertThat(assessment.initialScore()).isCloseTo(2.0 / 3, within(1e-9));
      verifyNoInteractions(relevanceProbe);
    }

    @Test
    @DisplayName("Should add the probe score as a weighted factor")
    void shouldAddProbeFactor() {
      Chunk chunk = new Chunk("c1", ML_TEXT);
      when(relevanceProbe.probe(eq(chunk), eq("machine learning"), any()))
          .thenReturn(ProbeResult.fromModel(0.8));

      ChunkAssessment assessment =
          assessor.assess(chunk, "machine learning", INITIAL_ONLY, CancellationSignal.none());

      AssessmentFactor llm = assessment.findFactor(FactorNames.LLM_ASSESSMENT).orElseThrow();
      assertThat(llm.contribution()).isCloseTo(0.64, within(1e-9));
      assertThat(llm.explanation()).isEqualTo("LLM relevance assessment: 0.80");
    }

    @Test
    @DisplayName("Should mark a heuristic fallback in the probe factor")
    void shouldMarkHeuristicFallback() {
      Chunk chunk = new Chunk("c1", "Short.");
      when(relevanceProbe.probe(eq(chunk), eq("test query"), any()))
          .thenReturn(ProbeResult.fallback(0.0, "unparseable response"));

      ChunkAssessment assessment =
          assessor.assess(chunk, "test query", INITIAL_ONLY, CancellationSignal.none());

      assertThat(assessment.findFactor(FactorNames.LLM_ASSESSMENT).orElseThrow().explanation())
          .endsWith("(heuristic fallback)");
      assertThat(assessment.initialScore()).isCloseTo(0.375, within(1e-9));
      assertThat(assessment.finalScore()).isCloseTo(0.375, within(1e-9));
      assertThat(assessment.suggestions()).contains(ScoreComposer.REFINE_BOUNDARIES);
    }

    @Test
    @DisplayName("Should weight criteria and clamp the initial score")
    void shouldWeightCriteriaAndClamp() {
      ChunkFilteringOptions options =
          INITIAL_ONLY.toBuilder()
              .criteria(List.of(FilterCriterion.of(CriterionType.KEYWORD_PRESENCE, "machine", 3.0)))
              .build();

      ChunkAssessment assessment =
          assessor.assess(new Chunk("c1", ML_TEXT), null, options, CancellationSignal.none());

      assertThat(assessment.findFactor("KeywordPresence").orElseThrow().contribution())
          .isEqualTo(3.0);
      assertThat(assessment.initialScore()).isEqualTo(1.0);
      assertThat(assessment.reasoning().get(ChunkAssessment.STAGE_INITIAL))
          .isEqualTo("Initial assessment based on 4 factors. Primary factor: KeywordPresence");
    }
  }

  @Test
  @DisplayName("Should report only the stages that ran")
  void shouldReportOnlyStagesThatRan() {
    ChunkAssessment assessment =
        assessor.assess(new Chunk("c1", ML_TEXT), null, INITIAL_ONLY, CancellationSignal.none());

    assertThat(assessment.reflectionScore()).isNull();
    assertThat(assessment.criticScore()).isNull();
    assertThat(assessment.reasoning()).containsOnlyKeys(ChunkAssessment.STAGE_INITIAL);
    assertThat(assessment.finalScore()).isEqualTo(assessment.initialScore());
  }

  @Test
  @DisplayName("Should run all three stages")
  void shouldRunAllThreeStages() {
    Chunk chunk = new Chunk("c1", ML_TEXT);
    when(relevanceProbe.probe(eq(chunk), eq("machine learning"), any()))
        .thenReturn(ProbeResult.fromModel(0.9));

    ChunkAssessment assessment =
        assessor.assess(
            chunk, "machine learning", ChunkFilteringOptions.defaults(), CancellationSignal.none());

    // no index or markers: structural importance stays at 0.5
    assertThat(assessment.initialScore()).isCloseTo(0.85, within(1e-9));
    assertThat(assessment.reflectionScore()).isCloseTo(0.85, within(1e-9));
    assertThat(assessment.criticScore()).isCloseTo(0.95, within(1e-9));
    assertThat(assessment.finalScore()).isCloseTo(0.88, within(1e-9));
    assertThat(assessment.confidence()).isBetween(0.0, 1.0);
    assertThat(assessment.reasoning().keySet())
        .containsExactly(
            ChunkAssessment.STAGE_INITIAL,
            ChunkAssessment.STAGE_REFLECTION,
            ChunkAssessment.STAGE_CRITIC);
    assertThat(assessment.factors()).extracting(AssessmentFactor::name).doesNotHaveDuplicates();
  }

  @Nested
  @DisplayName("Self-reflection")
  class SelfReflection {

    @Test
    @DisplayName("Should correct for a dominant factor")
    void shouldCorrectForDominantFactor() {
      StageResult result =
          assessor.selfReflection(
              new Chunk("c1", "Complete sentence here."),
              null,
              0.5,
              List.of(factor("A", 0.9), factor("B", 0.1)));

      assertThat(result.factors())
          .extracting(AssessmentFactor::name)
          .containsExactly(FactorNames.BIAS_CORRECTION);
      assertThat(result.factors().get(0).contribution()).isCloseTo(-0.1, within(1e-9));
      assertThat(result.score()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Should adjust towards a diverging alternative estimate")
    void shouldAdjustTowardsAlternativeEstimate() {
      StageResult result =
          assessor.selfReflection(
              new Chunk("c1", "Complete sentence here."),
              "zebra",
              0.9,
              List.of(factor("A", 0.5), factor("B", 0.5)));

      assertThat(result.factors())
          .extracting(AssessmentFactor::name)
          .containsExactly(FactorNames.ALTERNATIVE_PERSPECTIVE);
      assertThat(result.score()).isCloseTo(0.72, within(1e-9));
      assertThat(result.reasoning())
          .isEqualTo("Self-reflection identified 1 adjustments. Score adjusted from 0.90 to 0.72");
    }

    @Test
    @DisplayName("Should penalise incomplete sentences")
    void shouldPenaliseIncompleteSentences() {
      StageResult result =
          assessor.selfReflection(
              new Chunk("c1", "fragment without ending"),
              null,
              0.5,
              List.of(factor("A", 0.5), factor("B", 0.5)));

      assertThat(result.factors().get(0).name()).isEqualTo(FactorNames.COMPLETENESS_ADJUSTMENT);
      assertThat(result.factors().get(0).contribution()).isCloseTo(-0.35, within(1e-9));
      assertThat(result.score()).isCloseTo(0.15, within(1e-9));
    }
  }

  @Nested
  @DisplayName("Critic validation")
  class CriticValidation {

    @Test
    @DisplayName("Should penalise degenerate numeric text")
    void shouldPenaliseDegenerateText() {
      StageResult result =
          assessor.criticValidation(new Chunk("c1", "123 456"), 0.8, List.of(factor("A", 0.5)));

      assertThat(result.factors())
          .extracting(AssessmentFactor::name)
          .containsExactly(FactorNames.PATTERN_VALIDATION, FactorNames.EDGE_CASE_DETECTION);
      assertThat(result.score()).isCloseTo(0.2, within(1e-9));
      assertThat(result.reasoning())
          .isEqualTo("Critic validation performed 2 checks. Final validation score: 0.20");
    }

    @Test
    @DisplayName("Should flag inconsistent factors")
    void shouldFlagInconsistentFactors() {
      StageResult result =
          assessor.criticValidation(
              new Chunk("c1", ML_TEXT), 0.5, List.of(factor("A", 1.0), factor("B", -1.0)));

      assertThat(result.factors().get(0).name()).isEqualTo(FactorNames.CONSISTENCY_ISSUE);
      assertThat(result.factors().get(0).contribution()).isCloseTo(-0.3, within(1e-9));
    }

    @Test
    @DisplayName("Should never drop below zero")
    void shouldNeverDropBelowZero() {
      StageResult result = assessor.criticValidation(new Chunk("c1", "1 2 3"), 0.1, List.of());

      assertThat(result.score()).isEqualTo(0.0);
    }
  }

  @Test
  @DisplayName("Should measure concentration and consistency")
  void shouldMeasureConcentrationAndConsistency() {
    assertThat(ThreeStageAssessor.concentration(List.of(factor("A", 0.6), factor("B", -0.4))))
        .isCloseTo(0.6, within(1e-9));
    assertThat(ThreeStageAssessor.concentration(List.of())).isEqualTo(0.0);
    assertThat(ThreeStageAssessor.consistency(List.of(factor("A", 5.0)))).isEqualTo(1.0);
  }

  private static AssessmentFactor factor(String name, double contribution) {
    return new AssessmentFactor(name, contribution, "");
  }
}
