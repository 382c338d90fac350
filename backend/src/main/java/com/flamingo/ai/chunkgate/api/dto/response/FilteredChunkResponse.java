package com.flamingo.ai.chunkgate.api.dto.response;

import com.flamingo.ai.chunkgate.domain.model.MetadataValue;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FilteredChunk;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunk that passed the filter. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilteredChunkResponse {

  private String chunkId;
  private String content;
  private Map<String, MetadataValue> metadata;
  private double relevanceScore;
  private double qualityScore;
  private double combinedScore;
  private boolean passed;
  private String reason;
  private ChunkAssessment assessment;

  /** Creates a FilteredChunkResponse from a filtering result. */
  public static FilteredChunkResponse fromFilteredChunk(FilteredChunk filtered) {
    return FilteredChunkResponse.builder()
        .chunkId(filtered.chunk().id())
        .content(filtered.chunk().content())
        .metadata(filtered.chunk().metadata())
        .relevanceScore(filtered.relevanceScore())
        .qualityScore(filtered.qualityScore())
        .combinedScore(filtered.combinedScore())
        .passed(filtered.passed())
        .reason(filtered.reason())
        .assessment(filtered.assessment())
        .build();
  }
}
