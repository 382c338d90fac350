package com.flamingo.ai.chunkgate.service.filter;

import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FilteredChunk;
import java.util.List;

/**
 * Quality gate for RAG chunks. Scores each chunk with a three-stage assessment and keeps the ones
 * whose combined relevance/quality score reaches the threshold.
 *
 * <p>Completion-provider failures never escape these methods; they silently degrade to heuristic
 * scores.
 */
public interface ChunkFilteringService {

  /**
   * Filters chunks by relevance and quality.
   *
   * @param chunks chunks to filter, in document order
   * @param query query for relevance assessment; null for quality-only filtering
   * @param options filtering options; null for the configured defaults
   * @param cancellation checked before every batch
   * @return passed chunks, capped and ordered as the options request
   * @throws IllegalArgumentException on invalid arguments or options
   * @throws java.util.concurrent.CancellationException when cancellation was requested
   */
  List<FilteredChunk> filter(
      List<Chunk> chunks,
      String query,
      ChunkFilteringOptions options,
      CancellationSignal cancellation);

  default List<FilteredChunk> filter(
      List<Chunk> chunks, String query, ChunkFilteringOptions options) {
    return filter(chunks, query, options, CancellationSignal.none());
  }

  /**
   * Runs the three-stage assessment on a single chunk.
   *
   * @param chunk chunk to assess
   * @param query query for relevance assessment, may be null
   * @param options stage toggles and criteria; null for the configured defaults
   * @param cancellation forwarded to the completion provider
   * @return the detailed assessment
   * @throws IllegalArgumentException on invalid arguments or options
   */
  ChunkAssessment assess(
      Chunk chunk, String query, ChunkFilteringOptions options, CancellationSignal cancellation);

  default ChunkAssessment assess(Chunk chunk, String query, ChunkFilteringOptions options) {
    return assess(chunk, query, options, CancellationSignal.none());
  }
}
