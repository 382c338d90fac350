package com.flamingo.ai.chunkgate.domain.model;

/** Well-known chunk metadata keys read by the quality heuristics. */
public final class ChunkMetadataKeys {

  /** Zero-based position of the chunk in its source document. */
  public static final String INDEX = "index";

  /** Time the upstream splitter produced the chunk. */
  public static final String PROCESSED_AT = "processed_at";

  /** Source file type, e.g. PDF or DOCX. */
  public static final String FILE_TYPE = "file_type";

  private ChunkMetadataKeys() {}
}
