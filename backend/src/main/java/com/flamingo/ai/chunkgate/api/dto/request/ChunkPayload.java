package com.flamingo.ai.chunkgate.api.dto.request;

import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.domain.model.MetadataValue;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a single chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkPayload {

  @Size(max = 256, message = "Chunk id must not exceed 256 characters")
  private String id;

  private String content;

  private Map<String, Object> metadata;

  /** Converts the payload into a chunk, tagging JSON metadata values. */
  public Chunk toChunk() {
    if (metadata == null || metadata.isEmpty()) {
      return new Chunk(id, content);
    }
    Map<String, MetadataValue> typed = new LinkedHashMap<>();
    metadata.forEach((key, value) -> typed.put(key, MetadataValue.fromJson(value)));
    return new Chunk(id, content, typed);
  }
}
