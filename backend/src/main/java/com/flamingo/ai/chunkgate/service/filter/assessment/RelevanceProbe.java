package com.flamingo.ai.chunkgate.service.filter.assessment;

import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.completion.CompletionOptions;
import com.flamingo.ai.chunkgate.completion.TextCompletionService;
import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.service.filter.heuristic.ChunkHeuristics;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asks the completion provider for a bare 0-1 relevance rating of a chunk. A failed call and an
 * unparseable answer both yield the heuristic content-relevance score; the probe never throws on
 * provider failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelevanceProbe {

  static final int MAX_PREVIEW_CHARS = 500;

  private static final Pattern NUMBER =
      Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

  private final TextCompletionService completionService;
  private final MeterRegistry meterRegistry;

  /**
   * Rates the chunk against the query.
   *
   * @param chunk the chunk to rate
   * @param query non-blank query
   * @param cancellation forwarded to the completion provider
   * @return model score, or the heuristic fallback
   */
  public ProbeResult probe(Chunk chunk, String query, CancellationSignal cancellation) {
    String reply;
    try {
      reply =
          completionService.complete(
              buildPrompt(chunk, query), CompletionOptions.defaults(), cancellation);
    } catch (RuntimeException e) {
      return fallback(chunk, query, "completion failed: " + e.getMessage());
    }

    OptionalDouble parsed = parseScore(reply);
    if (parsed.isEmpty()) {
      return fallback(chunk, query, "unparseable response");
    }
    return ProbeResult.fromModel(ChunkHeuristics.clamp(parsed.getAsDouble()));
  }

  static OptionalDouble parseScore(String reply) {
    if (reply == null) {
      return OptionalDouble.empty();
    }
    String trimmed = reply.strip();
    if (!NUMBER.matcher(trimmed).matches()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Double.parseDouble(trimmed));
  }

  static String buildPrompt(Chunk chunk, String query) {
    String content = chunk.content();
    String preview =
        content.length() > MAX_PREVIEW_CHARS
            ? content.substring(0, MAX_PREVIEW_CHARS) + "..."
            : content;

    return """
        Rate the relevance of this text chunk to the query.
        Query: %s
        Chunk: %s

        Provide a relevance score from 0.0 to 1.0 where:
        - 0.0 = completely irrelevant
        - 0.5 = somewhat relevant
        - 1.0 = highly relevant

        Output only the numeric score.
        """
        .formatted(query, preview);
  }

  private ProbeResult fallback(Chunk chunk, String query, String detail) {
    double heuristic = ChunkHeuristics.contentRelevance(chunk.content(), query);
    log.warn(
        "Relevance probe fell back to heuristics for chunk {}: {} (score {})",
        chunk.id(),
        detail,
        String.format(Locale.ROOT, "%.2f", heuristic));
    meterRegistry.counter("chunk_filter.probe.fallback").increment();
    return ProbeResult.fallback(heuristic, detail);
  }
}
