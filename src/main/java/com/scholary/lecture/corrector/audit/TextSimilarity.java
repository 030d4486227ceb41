package com.scholary.lecture.corrector.audit;

/** Edit-distance based similarity of two texts. */
public final class TextSimilarity {

  private TextSimilarity() {}

  /**
   * Similarity ratio in [0, 1]: 1 - levenshtein(a, b) / max(|a|, |b|).
   *
   * @return 1.0 for identical texts (including two empty ones), 0.0 for fully disjoint texts
   */
  public static double ratio(String a, String b) {
    int longest = Math.max(a.length(), b.length());
    if (longest == 0) {
      return 1.0;
    }
    return 1.0 - (double) levenshtein(a, b) / longest;
  }

  static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];

    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }

    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int substitution = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(
                Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + substitution);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }

    return previous[b.length()];
  }
}
