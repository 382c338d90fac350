package com.flamingo.ai.chunkgate.service.filter.heuristic;

import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.domain.model.ChunkMetadataKeys;
import com.flamingo.ai.chunkgate.domain.model.MetadataValue;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Dispatches a {@link FilterCriterion} to the matching heuristic and returns its raw score. */
@Component
@RequiredArgsConstructor
public class CriterionEvaluator {

  private final Clock clock;

  /**
   * Evaluates the criterion without applying its weight.
   *
   * @param chunk the chunk under assessment
   * @param query the query, may be null
   * @param criterion the criterion to evaluate
   * @return the raw score; topic relevance may reach 1.2
   */
  public double evaluate(Chunk chunk, String query, FilterCriterion criterion) {
    return switch (criterion.type()) {
      case KEYWORD_PRESENCE -> keywordPresence(chunk.content(), criterion.value());
      case TOPIC_RELEVANCE -> ChunkHeuristics.contentRelevance(chunk.content(), query) * 1.2;
      case INFORMATION_DENSITY -> ChunkHeuristics.informationDensity(chunk.content());
      case FACTUAL_CONTENT -> ChunkHeuristics.factualContent(chunk.content());
      case RECENCY -> recency(chunk);
      case SOURCE_CREDIBILITY -> sourceCredibility(chunk);
      case COMPLETENESS -> ChunkHeuristics.completeness(chunk.content());
    };
  }

  double keywordPresence(String content, Object value) {
    String contentLower = content.toLowerCase(Locale.ROOT);

    if (value instanceof CharSequence keyword) {
      return contentLower.contains(keyword.toString().toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
    }
    if (value instanceof Collection<?> keywords) {
      if (keywords.isEmpty()) {
        return 0.5;
      }
      long matches =
          keywords.stream()
              .filter(
                  k -> k != null && contentLower.contains(k.toString().toLowerCase(Locale.ROOT)))
              .count();
      return (double) matches / keywords.size();
    }
    return 0.5;
  }

  double recency(Chunk chunk) {
    Optional<Instant> processedAt =
        chunk.metadataValue(ChunkMetadataKeys.PROCESSED_AT).flatMap(MetadataValue::asTimestamp);
    if (processedAt.isEmpty()) {
      return 0.5;
    }
    long ageDays = Duration.between(processedAt.get(), clock.instant()).toDays();
    if (ageDays < 7) {
      return 1.0;
    }
    if (ageDays < 30) {
      return 0.8;
    }
    if (ageDays < 90) {
      return 0.6;
    }
    return 0.4;
  }

  double sourceCredibility(Chunk chunk) {
    return chunk
        .metadataValue(ChunkMetadataKeys.FILE_TYPE)
        .map(value -> value.asText().toUpperCase(Locale.ROOT))
        .map(
            fileType ->
                switch (fileType) {
                  case "PDF" -> 0.8;
                  case "DOCX" -> 0.7;
                  case "TXT", "TEXT" -> 0.4;
                  default -> 0.5;
                })
        .orElse(0.5);
  }
}
