package com.flamingo.ai.chunkgate.domain.enums;

/** Kind tag of a chunk metadata value. */
public enum MetadataKind {
  INTEGER,
  STRING,
  TIMESTAMP,
  OTHER
}
