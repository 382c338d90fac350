package com.flamingo.ai.chunkgate.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for assessing a single chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessChunkRequest {

  @NotNull(message = "Chunk is required")
  @Valid
  private ChunkPayload chunk;

  private String query;

  @Valid private OptionsPayload options;
}
