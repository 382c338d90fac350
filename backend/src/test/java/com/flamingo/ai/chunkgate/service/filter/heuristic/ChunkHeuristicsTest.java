package com.flamingo.ai.chunkgate.service.filter.heuristic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.domain.model.MetadataValue;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkHeuristics Tests")
class ChunkHeuristicsTest {

  @Nested
  @DisplayName("contentRelevance")
  class ContentRelevance {

    @Test
    @DisplayName("Should return fraction of query terms found in content")
    void shouldReturnFractionOfQueryTermsFound() {
      assertThat(ChunkHeuristics.contentRelevance("Machine learning basics", "machine learning"))
          .isEqualTo(1.0);
      assertThat(ChunkHeuristics.contentRelevance("Machine vision", "machine learning"))
          .isEqualTo(0.5);
      assertThat(ChunkHeuristics.contentRelevance("Cats and dogs", "machine learning"))
          .isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should return neutral score without query")
    void shouldReturnNeutralScoreWithoutQuery() {
      assertThat(ChunkHeuristics.contentRelevance("anything", null)).isEqualTo(0.5);
      assertThat(ChunkHeuristics.contentRelevance("anything", "   ")).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should match query terms as substrings")
    void shouldMatchQueryTermsAsSubstrings() {
      assertThat(ChunkHeuristics.contentRelevance("Learning rates matter", "learn")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("informationDensity")
  class InformationDensity {

    @Test
    @DisplayName("Should score repeated words low")
    void shouldScoreRepeatedWordsLow() {
      assertThat(ChunkHeuristics.informationDensity("data data data data")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should compare words case-insensitively")
    void shouldCompareWordsCaseInsensitively() {
      assertThat(ChunkHeuristics.informationDensity("Data data")).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should add bonus for numeric tokens")
    void shouldAddBonusForNumericTokens() {
      assertThat(ChunkHeuristics.informationDensity("alpha alpha v2"))
          .isCloseTo(2.0 / 3 + 0.1, within(1e-9));
    }

    @Test
    @DisplayName("Should add bonus for technical tokens")
    void shouldAddBonusForTechnicalTokens() {
      assertThat(ChunkHeuristics.informationDensity("call call max_size"))
          .isCloseTo(2.0 / 3 + 0.1, within(1e-9));
    }

    @Test
    @DisplayName("Should cap density at one")
    void shouldCapDensityAtOne() {
      assertThat(ChunkHeuristics.informationDensity("Version 2.0 uses the_api")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return zero for empty content")
    void shouldReturnZeroForEmptyContent() {
      assertThat(ChunkHeuristics.informationDensity("")).isEqualTo(0.0);
      assertThat(ChunkHeuristics.informationDensity("   ")).isEqualTo(0.0);
    }
  }

  @Nested
  @DisplayName("structuralImportance")
  class StructuralImportance {

    @Test
    @DisplayName("Should return base score for plain text")
    void shouldReturnBaseScoreForPlainText() {
      assertThat(ChunkHeuristics.structuralImportance(new Chunk("c1", "plain words only")))
          .isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should reward headings near the start of the document")
    void shouldRewardHeadingsNearStart() {
      Chunk chunk = new Chunk("c1", "# Overview", Map.of("index", MetadataValue.ofInteger(0)));

      assertThat(ChunkHeuristics.structuralImportance(chunk)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Should ignore index metadata that is not an integer")
    void shouldIgnoreNonIntegerIndex() {
      Chunk chunk = Chunk.of("c1", "plain words only", Map.of("index", "0"));

      assertThat(ChunkHeuristics.structuralImportance(chunk)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should cap structural importance at one")
    void shouldCapAtOne() {
      Chunk chunk =
          Chunk.of("c1", "# Title\n```java\nint x;\n```\n| a | b |", Map.of("index", 1));

      assertThat(ChunkHeuristics.structuralImportance(chunk)).isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("Should score completeness from sentence start and end")
  void shouldScoreCompleteness() {
    assertThat(ChunkHeuristics.completeness("Hello world.")).isEqualTo(1.0);
    assertThat(ChunkHeuristics.completeness("Hello world")).isEqualTo(0.5);
    assertThat(ChunkHeuristics.completeness("hello world?")).isEqualTo(0.5);
    assertThat(ChunkHeuristics.completeness("hello world")).isEqualTo(0.0);
    assertThat(ChunkHeuristics.completeness("   ")).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should detect factual content signals")
  void shouldDetectFactualContentSignals() {
    assertThat(ChunkHeuristics.factualContent("plain words here")).isEqualTo(0.5);
    assertThat(ChunkHeuristics.factualContent("In 2023 [1] Alice, Bob and Carol met"))
        .isEqualTo(1.0);
  }

  @Nested
  @DisplayName("critic validators")
  class CriticValidators {

    @Test
    @DisplayName("Should penalise short text in pattern validation")
    void shouldPenaliseShortText() {
      assertThat(ChunkHeuristics.patternValidation("Short.")).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("Should handle empty text in pattern validation")
    void shouldHandleEmptyText() {
      assertThat(ChunkHeuristics.patternValidation("")).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("Should reward moderate length with sentence breaks")
    void shouldRewardModerateLengthWithSentenceBreaks() {
      String content =
          "Machine learning models learn patterns from training data. Supervised learning uses"
              + " labelled examples to fit a function.";

      assertThat(ChunkHeuristics.patternValidation(content)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    @DisplayName("Should penalise short mostly numeric text")
    void shouldPenaliseShortNumericText() {
      assertThat(ChunkHeuristics.edgeCaseAdjustment("123 4,567 8.9"))
          .isCloseTo(-0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should penalise repetitive text")
    void shouldPenaliseRepetitiveText() {
      String content = "word ".repeat(20);

      assertThat(ChunkHeuristics.edgeCaseAdjustment(content)).isCloseTo(-0.2, within(1e-9));
    }

    @Test
    @DisplayName("Should not adjust regular text")
    void shouldNotAdjustRegularText() {
      String content =
          "Supervised learning uses labelled examples to fit a function that generalises well.";

      assertThat(ChunkHeuristics.edgeCaseAdjustment(content)).isEqualTo(0.0);
    }
  }
}
