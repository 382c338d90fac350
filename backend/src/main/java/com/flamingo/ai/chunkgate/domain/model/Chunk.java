package com.flamingo.ai.chunkgate.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A unit of source text produced by an upstream splitter. The filter never modifies chunks; the
 * metadata map is copied on construction and exposed read-only.
 */
public record Chunk(String id, String content, Map<String, MetadataValue> metadata) {

  public Chunk {
    content = content == null ? "" : content;
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Chunk(String id, String content) {
    this(id, content, Map.of());
  }

  /**
   * Creates a chunk from untyped metadata, classifying each value.
   *
   * @param id chunk identifier
   * @param content chunk text
   * @param rawMetadata metadata values of any type, may be null
   * @return the chunk
   */
  public static Chunk of(String id, String content, Map<String, ?> rawMetadata) {
    if (rawMetadata == null) {
      return new Chunk(id, content);
    }
    Map<String, MetadataValue> typed = new LinkedHashMap<>();
    rawMetadata.forEach((key, value) -> typed.put(key, MetadataValue.of(value)));
    return new Chunk(id, content, typed);
  }

  public Optional<MetadataValue> metadataValue(String key) {
    return Optional.ofNullable(metadata.get(key));
  }

  /** Integer metadata value, present only when the value is tagged as an integer. */
  public OptionalInt integerMetadata(String key) {
    MetadataValue value = metadata.get(key);
    return value == null ? OptionalInt.empty() : value.asInteger();
  }
}
