package com.scholary.lecture.corrector.scoring;

import java.util.List;

/**
 * Text heuristics shared by the quality scorers and the audit report.
 *
 * <p>All checks are plain substring tests on the before/after text of one segment.
 */
public final class QualityHeuristics {

  static final double GOOD_LENGTH_BONUS = 0.1;
  static final double OVER_DELETION_PENALTY = 0.2;

  /** Phrases whose presence in the original and corrected text marks a clear fix. */
  private static final List<ImprovementPair> OBVIOUS_IMPROVEMENTS =
      List.of(
          new ImprovementPair("Day2になるDay2", "Day2"),
          new ImprovementPair("ますタイトル", "ます。タイトル"),
          new ImprovementPair("かなと思っている", "かと思"));

  /** Closing phrases that a bad rule tends to truncate at the front. */
  private static final List<String> CRITICAL_PHRASES = List.of("ありがとうございます", "よろしくお願いします");

  /** Words a lecture transcript should never lose during correction. */
  private static final List<String> IMPORTANT_KEYWORDS = List.of("講師", "講座", "皆さん", "研究室");

  private QualityHeuristics() {}

  /**
   * Score adjustment for the change in length.
   *
   * @return +0.1 for a ratio within [0.7, 1.3], -0.2 below 0.5, otherwise 0
   */
  public static double lengthAdjustment(String original, String corrected) {
    double ratio = (double) corrected.length() / Math.max(original.length(), 1);
    if (ratio >= 0.7 && ratio <= 1.3) {
      return GOOD_LENGTH_BONUS;
    }
    if (ratio < 0.5) {
      return -OVER_DELETION_PENALTY;
    }
    return 0.0;
  }

  public static boolean hasObviousImprovement(String original, String corrected) {
    for (ImprovementPair pair : OBVIOUS_IMPROVEMENTS) {
      if (original.contains(pair.before()) && corrected.contains(pair.after())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Detect corrections that made the text worse.
   *
   * <p>Fires when a critical phrase of the original survives only with its first character lost,
   * or when an important keyword of the original is missing from the corrected text.
   */
  public static boolean hasDeterioration(String original, String corrected) {
    for (String phrase : CRITICAL_PHRASES) {
      if (original.contains(phrase) && hasTruncatedCopy(corrected, phrase)) {
        return true;
      }
    }

    for (String keyword : IMPORTANT_KEYWORDS) {
      if (original.contains(keyword) && !corrected.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasTruncatedCopy(String text, String phrase) {
    String tail = phrase.substring(1);
    char head = phrase.charAt(0);

    int from = 0;
    int at;
    while ((at = text.indexOf(tail, from)) >= 0) {
      if (at == 0 || text.charAt(at - 1) != head) {
        return true;
      }
      from = at + 1;
    }
    return false;
  }

  private record ImprovementPair(String before, String after) {}
}
