package com.flamingo.ai.chunkgate.domain.enums;

/** Caller-selectable scoring rules evaluated alongside the built-in heuristics. */
public enum CriterionType {
  /** Presence of one or more keywords in the chunk. */
  KEYWORD_PRESENCE("KeywordPresence"),
  /** Query-term overlap, boosted by 20%. */
  TOPIC_RELEVANCE("TopicRelevance"),
  /** Lexical diversity plus numeric/technical token bonus. */
  INFORMATION_DENSITY("InformationDensity"),
  /** Numbers, citations and proper nouns. */
  FACTUAL_CONTENT("FactualContent"),
  /** Age of the {@code processed_at} metadata timestamp. */
  RECENCY("Recency"),
  /** Credibility derived from the {@code file_type} metadata. */
  SOURCE_CREDIBILITY("SourceCredibility"),
  /** Sentence-like start and end of the chunk. */
  COMPLETENESS("Completeness");

  private final String displayName;

  CriterionType(String displayName) {
    this.displayName = displayName;
  }

  /** Name used for the assessment factor this criterion produces. */
  public String getDisplayName() {
    return displayName;
  }
}
