package com.flamingo.ai.chunkgate.service.filter.model;

import com.flamingo.ai.chunkgate.domain.model.Chunk;

/**
 * A chunk together with its filtering verdict.
 *
 * @param chunk the caller's chunk, unchanged
 * @param relevanceScore final score of the assessment
 * @param qualityScore quality derived from density and completeness factors
 * @param combinedScore relevance/quality blend compared against the threshold
 * @param passed whether the chunk is kept
 * @param assessment full three-stage assessment
 * @param reason short human-readable summary of the decision
 */
public record FilteredChunk(
    Chunk chunk,
    double relevanceScore,
    double qualityScore,
    double combinedScore,
    boolean passed,
    ChunkAssessment assessment,
    String reason) {}
