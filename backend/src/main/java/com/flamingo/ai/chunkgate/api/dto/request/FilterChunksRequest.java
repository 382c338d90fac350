package com.flamingo.ai.chunkgate.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for filtering a list of chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterChunksRequest {

  @NotNull(message = "Chunks are required")
  private List<@NotNull @Valid ChunkPayload> chunks;

  /** Optional; without a query only quality signals contribute. */
  private String query;

  @Valid private OptionsPayload options;
}
