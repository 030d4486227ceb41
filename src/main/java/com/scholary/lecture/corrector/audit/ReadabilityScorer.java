package com.scholary.lecture.corrector.audit;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rough readability estimate of a transcript segment, in [0, 1].
 *
 * <p>Adds up to 0.3 for punctuation density, 0.3 for sentence length, 0.2 for a low filler
 * ratio, and 0.2 for correctly written technical terms. Tokens are whitespace separated.
 */
public final class ReadabilityScorer {

  private static final Pattern COMMA_OR_STOP = Pattern.compile("[。、]");
  private static final Pattern SENTENCE_END = Pattern.compile("[。！？]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final List<String> FILLERS = List.of("えー", "あのー", "なんか");
  private static final List<String> PROPER_TERMS = List.of("BERT", "GPT", "LLM", "Transformer");

  private ReadabilityScorer() {}

  public static double improvement(String original, String corrected) {
    return score(corrected) - score(original);
  }

  public static double score(String text) {
    double score = 0.0;

    double punctuationDensity = (double) count(COMMA_OR_STOP, text) / Math.max(tokenCount(text), 1);
    if (punctuationDensity >= 0.1 && punctuationDensity <= 0.3) {
      score += 0.3;
    }

    List<String> sentences =
        Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.isBlank()).collect(Collectors.toList());
    double averageTokens =
        sentences.stream().mapToInt(ReadabilityScorer::tokenCount).sum()
            / (double) Math.max(sentences.size(), 1);
    if (averageTokens >= 10 && averageTokens <= 25) {
      score += 0.3;
    }

    int fillers = 0;
    for (String filler : FILLERS) {
      fillers += occurrences(text, filler);
    }
    double fillerRatio = (double) fillers / Math.max(text.length(), 1);
    score += Math.max(0.0, 0.2 - fillerRatio * 10);

    double termBonus = 0.0;
    for (String term : PROPER_TERMS) {
      if (text.contains(term)) {
        termBonus += 0.05;
      }
    }
    score += Math.min(0.2, termBonus);

    return Math.min(score, 1.0);
  }

  static int tokenCount(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
  }

  static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  static int occurrences(String text, String needle) {
    int count = 0;
    int from = text.indexOf(needle);
    while (from >= 0) {
      count++;
      from = text.indexOf(needle, from + needle.length());
    }
    return count;
  }
}
