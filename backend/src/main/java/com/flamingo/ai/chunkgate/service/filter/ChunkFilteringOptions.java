package com.flamingo.ai.chunkgate.service.filter;

import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Options for a single filter or assess call. */
@Getter
@Builder(toBuilder = true)
@ToString
public class ChunkFilteringOptions {

  /** Minimum combined score a chunk needs to pass. */
  @Builder.Default private final double minRelevanceScore = 0.7;

  /** Maximum number of chunks returned; null means unlimited. */
  private final Integer maxChunks;

  /** Re-sort passed chunks by their {@code index} metadata. */
  @Builder.Default private final boolean preserveOrder = false;

  /** Share of quality in the combined score: 0 is pure relevance, 1 pure quality. */
  @Builder.Default private final double qualityWeight = 0.3;

  @Builder.Default private final boolean useSelfReflection = true;

  @Builder.Default private final boolean useCriticValidation = true;

  /** Number of chunks assessed concurrently; batches run one after another. */
  @Builder.Default private final int batchSize = 5;

  @Builder.Default private final List<FilterCriterion> criteria = List.of();

  public static ChunkFilteringOptions defaults() {
    return ChunkFilteringOptions.builder().build();
  }

  /**
   * Checks caller-supplied values.
   *
   * @throws IllegalArgumentException if any value is out of range
   */
  public void validate() {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
    }
    if (maxChunks != null && maxChunks < 1) {
      throw new IllegalArgumentException("maxChunks must be at least 1, was " + maxChunks);
    }
    if (Double.isNaN(qualityWeight) || qualityWeight < 0.0 || qualityWeight > 1.0) {
      throw new IllegalArgumentException(
          "qualityWeight must be within [0, 1], was " + qualityWeight);
    }
    if (Double.isNaN(minRelevanceScore)) {
      throw new IllegalArgumentException("minRelevanceScore must be a number");
    }
    if (criteria == null || criteria.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("criteria must not be null or contain null entries");
    }
  }
}
