package com.flamingo.ai.chunkgate.api.rest;

import com.flamingo.ai.chunkgate.api.dto.request.AssessChunkRequest;
import com.flamingo.ai.chunkgate.api.dto.request.ChunkPayload;
import com.flamingo.ai.chunkgate.api.dto.request.FilterChunksRequest;
import com.flamingo.ai.chunkgate.api.dto.request.OptionsPayload;
import com.flamingo.ai.chunkgate.api.dto.response.FilteredChunkResponse;
import com.flamingo.ai.chunkgate.config.ChunkFilterConfig;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringService;
import com.flamingo.ai.chunkgate.service.filter.model.ChunkAssessment;
import com.flamingo.ai.chunkgate.service.filter.model.FilteredChunk;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunk filtering and assessment. */
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
@Slf4j
public class ChunkFilterController {

  private final ChunkFilteringService chunkFilteringService;
  private final ChunkFilterConfig chunkFilterConfig;

  /**
   * Filters chunks by relevance and quality.
   *
   * @param request chunks, optional query and option overrides
   * @return the chunks that passed, in the order the options request
   */
  @PostMapping("/filter")
  public ResponseEntity<List<FilteredChunkResponse>> filterChunks(
      @Valid @RequestBody FilterChunksRequest request) {

    log.debug(
        "Filter request: chunks={}, hasQuery={}",
        request.getChunks().size(),
        request.getQuery() != null);

    List<Chunk> chunks = request.getChunks().stream().map(ChunkPayload::toChunk).toList();
    List<FilteredChunk> filtered =
        chunkFilteringService.filter(chunks, request.getQuery(), resolve(request.getOptions()));

    return ResponseEntity.ok(
        filtered.stream().map(FilteredChunkResponse::fromFilteredChunk).toList());
  }

  /**
   * Runs the three-stage assessment on one chunk.
   *
   * @param request the chunk, optional query and option overrides
   * @return the detailed assessment
   */
  @PostMapping("/assess")
  public ResponseEntity<ChunkAssessment> assessChunk(
      @Valid @RequestBody AssessChunkRequest request) {
    ChunkAssessment assessment =
        chunkFilteringService.assess(
            request.getChunk().toChunk(), request.getQuery(), resolve(request.getOptions()));
    return ResponseEntity.ok(assessment);
  }

  private ChunkFilteringOptions resolve(OptionsPayload overrides) {
    ChunkFilteringOptions defaults = chunkFilterConfig.toOptions();
    return overrides == null ? defaults : overrides.applyTo(defaults);
  }
}
