package com.flamingo.ai.chunkgate.service.filter.assessment;

/**
 * Outcome of the language-model relevance probe.
 *
 * @param score relevance in [0, 1]
 * @param source whether the score came from the model or from the heuristic fallback
 * @param detail why the fallback was used; empty for model scores
 */
public record ProbeResult(double score, Source source, String detail) {

  /** Origin of a probe score. */
  public enum Source {
    MODEL,
    FALLBACK
  }

  public static ProbeResult fromModel(double score) {
    return new ProbeResult(score, Source.MODEL, "");
  }

  public static ProbeResult fallback(double score, String detail) {
    return new ProbeResult(score, Source.FALLBACK, detail);
  }

  public boolean isFallback() {
    return source == Source.FALLBACK;
  }
}
