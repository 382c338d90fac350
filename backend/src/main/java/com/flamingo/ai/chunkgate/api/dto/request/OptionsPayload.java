package com.flamingo.ai.chunkgate.api.dto.request;

import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for filtering options. Every field is optional; unset fields keep the configured
 * default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionsPayload {

  private Double minRelevanceScore;

  @Min(value = 1, message = "maxChunks must be at least 1")
  private Integer maxChunks;

  private Boolean preserveOrder;

  @DecimalMin(value = "0.0", message = "qualityWeight must be at least 0.0")
  @DecimalMax(value = "1.0", message = "qualityWeight must be at most 1.0")
  private Double qualityWeight;

  private Boolean useSelfReflection;

  private Boolean useCriticValidation;

  @Min(value = 1, message = "batchSize must be at least 1")
  private Integer batchSize;

  private List<@NotNull @Valid CriterionPayload> criteria;

  /**
   * Overlays the set fields on the given defaults.
   *
   * @param defaults configured defaults
   * @return the merged options
   */
  public ChunkFilteringOptions applyTo(ChunkFilteringOptions defaults) {
    ChunkFilteringOptions.ChunkFilteringOptionsBuilder builder = defaults.toBuilder();
    if (minRelevanceScore != null) {
      builder.minRelevanceScore(minRelevanceScore);
    }
    if (maxChunks != null) {
      builder.maxChunks(maxChunks);
    }
    if (preserveOrder != null) {
      builder.preserveOrder(preserveOrder);
    }
    if (qualityWeight != null) {
      builder.qualityWeight(qualityWeight);
    }
    if (useSelfReflection != null) {
      builder.useSelfReflection(useSelfReflection);
    }
    if (useCriticValidation != null) {
      builder.useCriticValidation(useCriticValidation);
    }
    if (batchSize != null) {
      builder.batchSize(batchSize);
    }
    if (criteria != null) {
      builder.criteria(criteria.stream().map(CriterionPayload::toCriterion).toList());
    }
    return builder.build();
  }
}
