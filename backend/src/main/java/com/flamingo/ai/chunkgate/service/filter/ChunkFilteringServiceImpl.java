package com.flamingo.ai.chunkgate.service.filter;

import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.config.ChunkFilterConfig;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.domain.model.ChunkMetadataKeys;
import com.flamingo.ai.chunkgate.domain.model.MetadataValue;
import com.flamingo.ai.chunkgate.service.filter.assessment.ScoreComposer;
import com.flamingo.ai.chunkgate.service.filter.assessment.ThreeStageAssessor;
import com.flamingo.ai.chunkgate.service.filter.heuristic.CriterionEvaluator;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import com.flamingo.ai.chunkgate.service.filter.model.FilteredChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Batch implementation of {@link ChunkFilteringService}.
 *
 * <p>Chunks are processed in consecutive batches of {@code batchSize}. Within a batch every chunk
 * is assessed concurrently on the assessment executor and the batch is joined before the next one
 * starts, so {@code batchSize} bounds the number of in-flight completion calls. Cancellation is
 * observed only between batches.
 */
@Service
@Slf4j
public class ChunkFilteringServiceImpl implements ChunkFilteringService {

  private static final double MANDATORY_MINIMUM = 0.5;

  private final ThreeStageAssessor assessor;
  private final ScoreComposer scoreComposer;
  private final CriterionEvaluator criterionEvaluator;
  private final ChunkFilterConfig chunkFilterConfig;
  private final MeterRegistry meterRegistry;
  private final Executor assessmentExecutor;

  public ChunkFilteringServiceImpl(
      ThreeStageAssessor assessor,
      ScoreComposer scoreComposer,
      CriterionEvaluator criterionEvaluator,
      ChunkFilterConfig chunkFilterConfig,
      MeterRegistry meterRegistry,
      @Qualifier("assessmentExecutor") Executor assessmentExecutor) {
    this.assessor = assessor;
    this.scoreComposer = scoreComposer;
    this.criterionEvaluator = criterionEvaluator;
    this.chunkFilterConfig = chunkFilterConfig;
    this.meterRegistry = meterRegistry;
    this.assessmentExecutor = assessmentExecutor;
  }

  @Override
  @Timed(value = "chunk_filter.filter", description = "Time to filter a list of chunks")
  public List<FilteredChunk> filter(
      List<Chunk> chunks,
      String query,
      ChunkFilteringOptions options,
      CancellationSignal cancellation) {
    if (chunks == null || chunks.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("chunks must not be null or contain null entries");
    }
    ChunkFilteringOptions resolved = resolve(options);
    CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;

    if (chunks.isEmpty()) {
      log.debug("No chunks to filter");
      return List.of();
    }

    int batchSize = resolved.getBatchSize();
    log.debug("Filtering {} chunks in batches of {}", chunks.size(), batchSize);

    List<FilteredChunk> evaluated = new ArrayList<>(chunks.size());
    for (int start = 0; start < chunks.size(); start += batchSize) {
      signal.throwIfCancellationRequested();

      int end = Math.min(start + batchSize, chunks.size());
      log.debug("Processing batch {}-{} of {}", start, end, chunks.size());
      evaluated.addAll(evaluateBatch(chunks.subList(start, end), query, resolved, signal));
    }

    List<FilteredChunk> result = aggregate(evaluated, resolved);

    long passedCount = evaluated.stream().filter(FilteredChunk::passed).count();
    meterRegistry.counter("chunk_filter.chunks.passed").increment(passedCount);
    meterRegistry.counter("chunk_filter.chunks.rejected").increment(evaluated.size() - passedCount);
    log.info(
        "Filtered {} chunks: {} passed, {} returned (threshold {})",
        evaluated.size(),
        passedCount,
        result.size(),
        String.format(Locale.ROOT, "%.2f", resolved.getMinRelevanceScore()));

    return result;
  }

  @Override
  @Timed(value = "chunk_filter.assess", description = "Time to assess a single chunk")
  public ChunkAssessment assess(
      Chunk chunk, String query, ChunkFilteringOptions options, CancellationSignal cancellation) {
    if (chunk == null) {
      throw new IllegalArgumentException("chunk must not be null");
    }
    ChunkFilteringOptions resolved = resolve(options);
    return assessor.assess(
        chunk, query, resolved, cancellation == null ? CancellationSignal.none() : cancellation);
  }

  private List<FilteredChunk> evaluateBatch(
      List<Chunk> batch,
      String query,
      ChunkFilteringOptions options,
      CancellationSignal cancellation) {
    List<CompletableFuture<FilteredChunk>> futures =
        batch.stream()
            .map(
                chunk ->
                    CompletableFuture.supplyAsync(
                        () -> assessAndScore(chunk, query, options, cancellation),
                        assessmentExecutor))
            .toList();

    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private FilteredChunk assessAndScore(
      Chunk chunk, String query, ChunkFilteringOptions options, CancellationSignal cancellation) {
    ChunkAssessment assessment = assessor.assess(chunk, query, options, cancellation);

    double relevance = assessment.finalScore();
    double quality = scoreComposer.qualityScore(assessment);
    double combined = scoreComposer.combinedScore(relevance, quality, options.getQualityWeight());
    Optional<FilterCriterion> failedMandatory =
        firstFailedMandatory(chunk, query, options.getCriteria());
    boolean passed = combined >= options.getMinRelevanceScore() && failedMandatory.isEmpty();

    String reason =
        scoreComposer.reason(
            assessment, passed, combined, options.getMinRelevanceScore(), failedMandatory);
    return new FilteredChunk(chunk, relevance, quality, combined, passed, assessment, reason);
  }

  private Optional<FilterCriterion> firstFailedMandatory(
      Chunk chunk, String query, List<FilterCriterion> criteria) {
    return criteria.stream()
        .filter(FilterCriterion::mandatory)
        .filter(c -> criterionEvaluator.evaluate(chunk, query, c) < MANDATORY_MINIMUM)
        .findFirst();
  }

  /**
   * Keeps passed chunks, applies the cap by descending combined score, then optionally restores
   * document order. Both sorts are stable: chunks without an index keep their relative order.
   */
  private List<FilteredChunk> aggregate(
      List<FilteredChunk> evaluated, ChunkFilteringOptions options) {
    List<FilteredChunk> kept =
        new ArrayList<>(evaluated.stream().filter(FilteredChunk::passed).toList());

    if (options.getMaxChunks() != null) {
      kept.sort(Comparator.comparingDouble(FilteredChunk::combinedScore).reversed());
      if (kept.size() > options.getMaxChunks()) {
        kept = new ArrayList<>(kept.subList(0, options.getMaxChunks()));
      }
    }

    if (options.isPreserveOrder()) {
      kept.sort(Comparator.comparingInt(filtered -> documentIndex(filtered.chunk())));
    }
    return List.copyOf(kept);
  }

  /** Index metadata as an int; chunks without a usable index sort last. */
  static int documentIndex(Chunk chunk) {
    Optional<MetadataValue> value = chunk.metadataValue(ChunkMetadataKeys.INDEX);
    if (value.isEmpty()) {
      return Integer.MAX_VALUE;
    }
    if (value.get().asInteger().isPresent()) {
      return value.get().asInteger().getAsInt();
    }
    try {
      return Integer.parseInt(value.get().asText().strip());
    } catch (NumberFormatException e) {
      return Integer.MAX_VALUE;
    }
  }

  private ChunkFilteringOptions resolve(ChunkFilteringOptions options) {
    ChunkFilteringOptions resolved = options == null ? chunkFilterConfig.toOptions() : options;
    resolved.validate();
    return resolved;
  }
}
