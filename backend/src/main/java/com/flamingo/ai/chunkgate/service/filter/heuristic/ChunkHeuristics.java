package com.flamingo.ai.chunkgate.service.filter.heuristic;

import com.flamingo.ai.chunkgate.domain.model.Chunk;
import com.flamingo.ai.chunkgate.domain.model.ChunkMetadataKeys;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic text heuristics used by every assessment stage. All methods are pure and return
 * scores in [0, 1] unless documented otherwise.
 */
public final class ChunkHeuristics {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private ChunkHeuristics() {}

  /** Splits on whitespace, dropping empty tokens. */
  public static String[] words(String text) {
    if (text == null) {
      return new String[0];
    }
    String trimmed = text.strip();
    return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
  }

  /** True when the query carries at least one non-whitespace character. */
  public static boolean hasQuery(String query) {
    return query != null && !query.isBlank();
  }

  /**
   * Fraction of query terms found as substrings of the content, case-insensitively.
   *
   * @return 0.5 when there is no query
   */
  public static double contentRelevance(String content, String query) {
    if (!hasQuery(query)) {
      return 0.5;
    }
    String[] terms = words(query.toLowerCase(Locale.ROOT));
    String contentLower = content.toLowerCase(Locale.ROOT);

    long matches = Arrays.stream(terms).filter(contentLower::contains).count();
    return (double) matches / terms.length;
  }

  /**
   * Unique-word ratio plus 0.1 when any word contains a digit and 0.1 when any word contains
   * {@code _}, {@code -} or {@code .}.
   */
  public static double informationDensity(String content) {
    String[] words = words(content);
    if (words.length == 0) {
      return 0.0;
    }

    double density = (double) uniqueCount(words) / words.length;

    if (Arrays.stream(words).anyMatch(ChunkHeuristics::containsDigit)) {
      density += 0.1;
    }
    if (Arrays.stream(words)
        .anyMatch(w -> w.indexOf('_') >= 0 || w.indexOf('-') >= 0 || w.indexOf('.') >= 0)) {
      density += 0.1;
    }
    return Math.min(1.0, density);
  }

  /** Headings, code, tables and early position in the document raise importance. */
  public static double structuralImportance(Chunk chunk) {
    double score = 0.5;
    String content = chunk.content();
    String lower = content.toLowerCase(Locale.ROOT);

    if (content.startsWith("#") || lower.contains("heading")) {
      score += 0.2;
    }
    if (content.contains("```") || lower.contains("code")) {
      score += 0.15;
    }
    if (lower.contains("table") || content.indexOf('|') >= 0) {
      score += 0.15;
    }
    if (chunk.integerMetadata(ChunkMetadataKeys.INDEX).orElse(Integer.MAX_VALUE) < 3) {
      score += 0.1;
    }
    return Math.min(1.0, score);
  }

  /** 0.5 for an upper-case first character plus 0.5 for terminal punctuation. */
  public static double completeness(String content) {
    String trimmed = content == null ? "" : content.strip();
    if (trimmed.isEmpty()) {
      return 0.0;
    }
    boolean hasStart = Character.isUpperCase(trimmed.charAt(0));
    char last = trimmed.charAt(trimmed.length() - 1);
    boolean hasEnd = last == '.' || last == '!' || last == '?';
    return (hasStart ? 0.5 : 0.0) + (hasEnd ? 0.5 : 0.0);
  }

  /** Numbers, bracketed citations and capitalised terms signal factual content. */
  public static double factualContent(String content) {
    double score = 0.5;

    if (DIGITS.matcher(content).find()) {
      score += 0.2;
    }
    if (content.indexOf('[') >= 0 && content.indexOf(']') >= 0) {
      score += 0.15;
    }
    long capitalized =
        Arrays.stream(words(content))
            .filter(w -> w.length() > 2 && Character.isUpperCase(w.charAt(0)))
            .count();
    if (capitalized > 2) {
      score += 0.15;
    }
    return Math.min(1.0, score);
  }

  /**
   * Shape checks on the raw text: moderate length and sentence breaks are rewarded, very short
   * or line-broken text is penalised.
   */
  public static double patternValidation(String content) {
    double score = 0.5;
    int length = content.length();

    if (length > 100 && length < 2000) {
      score += 0.1;
    }
    if (content.contains(". ") || content.contains(".\n")) {
      score += 0.1;
    }
    if (length < 50) {
      score -= 0.2;
    }
    if (length > 0) {
      double newlineRatio = (double) content.chars().filter(c -> c == '\n').count() / length;
      if (newlineRatio > 0.05) {
        score -= 0.1;
      }
    }
    return clamp(score);
  }

  /**
   * Net penalty for degenerate chunks. Returns 0 or a negative adjustment, not a score.
   */
  public static double edgeCaseAdjustment(String content) {
    double adjustment = 0.0;

    if (content.length() < 50) {
      adjustment -= 0.3;
    }

    String[] words = words(content);
    if (words.length > 0) {
      long numeric = Arrays.stream(words).filter(ChunkHeuristics::isNumericToken).count();
      if ((double) numeric / words.length > 0.8) {
        adjustment -= 0.2;
      }
      if (words.length > 10 && (double) uniqueCount(words) / words.length < 0.3) {
        adjustment -= 0.2;
      }
    }
    return adjustment;
  }

  public static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static int uniqueCount(String[] words) {
    Set<String> unique = new HashSet<>();
    for (String word : words) {
      unique.add(word.toLowerCase(Locale.ROOT));
    }
    return unique.size();
  }

  private static boolean containsDigit(String word) {
    return word.chars().anyMatch(Character::isDigit);
  }

  private static boolean isNumericToken(String word) {
    return word.chars().allMatch(c -> Character.isDigit(c) || c == '.' || c == ',');
  }
}
