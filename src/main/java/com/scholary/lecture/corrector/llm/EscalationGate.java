package com.scholary.lecture.corrector.llm;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Decides whether a rule-corrected segment still needs the LLM.
 *
 * <p>Each detector is a known misrecognition that the rule dictionaries cannot fix safely because
 * the right replacement depends on context: phonetic confusables, garbled person names, and
 * fragments of organization or product names.
 */
@Component
public class EscalationGate {

  private static final List<Pattern> DETECTORS =
      List.of(
          Pattern.compile("[あ-ん]{3,}も"), // run of kana swallowed by も (とも配も)
          Pattern.compile("帰漏らし"), // 聞き漏らし
          Pattern.compile("エポック"), // often a person's name, not the ML term
          Pattern.compile("簡易回"), // 範囲外
          Pattern.compile("バット[^ー]"), // バッド
          Pattern.compile("お腹切り"),
          Pattern.compile("円周部分"), // 演習部分
          Pattern.compile("ベルトンさん"),
          Pattern.compile("松尾岩澤研"),
          Pattern.compile("スレッド1"),
          Pattern.compile("Googleコラボ"));

  public boolean requiresEscalation(String text) {
    for (Pattern detector : DETECTORS) {
      if (detector.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  /**
   * List the detectors that fire on a text, for logging.
   *
   * @param text the rule-corrected text
   * @return the matching detector patterns, in detector order
   */
  public List<String> matchingDetectors(String text) {
    return DETECTORS.stream()
        .filter(detector -> detector.matcher(text).find())
        .map(Pattern::pattern)
        .collect(Collectors.toList());
  }
}
