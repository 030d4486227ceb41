package com.scholary.lecture.corrector.correction;

import static com.scholary.lecture.corrector.correction.CorrectionCategory.ENDING_FIX;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.FILLER_REMOVAL;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.NATURALIZATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.NORMALIZATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.PUNCTUATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.REPETITION_REMOVAL;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.TECHNICAL_TERM;

import com.scholary.lecture.corrector.config.CorrectionProperties.CustomTerms;
import com.scholary.lecture.corrector.config.CorrectionProperties.TermEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in correction dictionaries.
 *
 * <p>Each stage is plain data: an ordered list of {@link CorrectionRule}s. The pipeline runs them
 * uniformly, and the audit side ({@code CorrectionDetector}) reads the same lists to recognize
 * corrections after the fact.
 */
public final class CorrectionRules {

  // Katakana guard so a term only matches as a whole katakana word (ベルト, not ベルトコンベア)
  private static final String NOT_AFTER_KATAKANA = "(?<![ァ-ヶー])";
  private static final String NOT_BEFORE_KATAKANA = "(?![ァ-ヶー])";

  /** A latin, katakana or kanji phrase immediately repeated around なる ("Day2になるDay2"). */
  public static final Pattern DUPLICATED_PHRASE =
      Pattern.compile(
          "([\\p{IsLatin}\\p{IsKatakana}\\p{IsHan}\\p{Nd}ー]{2,})になる\\1",
          Pattern.UNICODE_CHARACTER_CLASS);

  /** Filler words counted when auditing a corrected transcript. */
  public static final List<String> FILLER_WORDS = List.of("えー", "あのー", "なんか", "その", "ちょっと");

  private static final List<CorrectionRule> TECHNICAL_TERMS =
      List.of(
          CorrectionRule.of(NOT_AFTER_KATAKANA + "ベルト" + NOT_BEFORE_KATAKANA, "ベルトン", TECHNICAL_TERM),
          CorrectionRule.of(NOT_AFTER_KATAKANA + "ベル\\s+ト" + NOT_BEFORE_KATAKANA, "ベルトン", TECHNICAL_TERM),
          CorrectionRule.of(NOT_AFTER_KATAKANA + "ジーピーティー" + NOT_BEFORE_KATAKANA, "GPT", TECHNICAL_TERM),
          CorrectionRule.of(NOT_AFTER_KATAKANA + "ラーム" + NOT_BEFORE_KATAKANA, "Llama", TECHNICAL_TERM),
          CorrectionRule.of(NOT_AFTER_KATAKANA + "エルエルエム" + NOT_BEFORE_KATAKANA, "LLM", TECHNICAL_TERM),
          CorrectionRule.of(NOT_AFTER_KATAKANA + "エルエム" + NOT_BEFORE_KATAKANA, "LLM", TECHNICAL_TERM),
          CorrectionRule.of("松尾研(?!究室)", "松尾研究室", TECHNICAL_TERM),
          CorrectionRule.of("とも配も", "ともかく", TECHNICAL_TERM),
          CorrectionRule.of("編集BERT", "BERT", TECHNICAL_TERM),
          CorrectionRule.of("あの後単語", "後ほど", TECHNICAL_TERM));

  private static final List<CorrectionRule> ENDING_FIXES =
      List.of(
          // Must run before ございす so the dropped leading あ is restored too
          CorrectionRule.of("(?<!あ)りがとうございす", "ありがとうございます", ENDING_FIX),
          CorrectionRule.of("申しす", "申します", ENDING_FIX),
          CorrectionRule.of("ございす", "ございます", ENDING_FIX),
          CorrectionRule.of("思いす(?![ぎご])", "思います", ENDING_FIX));

  private static final List<CorrectionRule> REPETITIONS =
      List.of(
          new CorrectionRule(DUPLICATED_PHRASE, "$1", REPETITION_REMOVAL),
          CorrectionRule.of("(?<!\\S)(\\S+)(?:\\s+\\1)+(?!\\S)", "$1", REPETITION_REMOVAL));

  private static final List<CorrectionRule> FILLERS =
      List.of(
          CorrectionRule.of("(^|[\\s、。])(?:えーと|えっと|えー+|あー+|うーん|あのー+)[、\\s]*", "$1", FILLER_REMOVAL),
          CorrectionRule.of("(^|[\\s、。])あの[、\\s]+", "$1", FILLER_REMOVAL),
          CorrectionRule.of("なんか\\s+", "", FILLER_REMOVAL));

  private static final List<CorrectionRule> NATURALIZATIONS =
      List.of(
          CorrectionRule.of("だったのかな[、。]", "でした。", NATURALIZATION),
          CorrectionRule.of("あるのかなと思", "あると思", NATURALIZATION),
          CorrectionRule.of("かなというふう", "かと思", NATURALIZATION),
          CorrectionRule.of("っていう", "という", NATURALIZATION),
          CorrectionRule.of("だったりとか", "や", NATURALIZATION));

  private static final List<CorrectionRule> PUNCTUATIONS =
      List.of(
          CorrectionRule.of(
              "(申します|ございます|思います)(?!が|けど|ので|から)"
                  + "(?=[\\p{IsHiragana}\\p{IsKatakana}\\p{IsHan}A-Za-z0-9]|\\s*$)",
              "$1。",
              PUNCTUATION));

  private static final List<CorrectionRule> NORMALIZATIONS =
      List.of(
          CorrectionRule.of("\\s{2,}", " ", NORMALIZATION),
          CorrectionRule.of("\\s+([。、！？])", "$1", NORMALIZATION),
          CorrectionRule.of("^\\s+|\\s+$", "", NORMALIZATION));

  private CorrectionRules() {}

  /**
   * The built-in rules for every stage.
   *
   * @return an ordered, unmodifiable map from stage to its rules
   */
  public static Map<CorrectionStage, List<CorrectionRule>> defaults() {
    Map<CorrectionStage, List<CorrectionRule>> rules = new EnumMap<>(CorrectionStage.class);
    rules.put(CorrectionStage.TECHNICAL_TERMS, TECHNICAL_TERMS);
    rules.put(CorrectionStage.ENDING_FIXES, ENDING_FIXES);
    rules.put(CorrectionStage.REPETITION_REMOVAL, REPETITIONS);
    rules.put(CorrectionStage.FILLER_REMOVAL, FILLERS);
    rules.put(CorrectionStage.NATURALIZATION, NATURALIZATIONS);
    rules.put(CorrectionStage.PUNCTUATION, PUNCTUATIONS);
    rules.put(CorrectionStage.NORMALIZATION, NORMALIZATIONS);
    return Collections.unmodifiableMap(rules);
  }

  public static List<CorrectionRule> technicalTerms() {
    return TECHNICAL_TERMS;
  }

  public static List<CorrectionRule> endingFixes() {
    return ENDING_FIXES;
  }

  public static List<CorrectionRule> naturalizations() {
    return NATURALIZATIONS;
  }

  /**
   * Turn configured custom dictionaries into technical-term rules.
   *
   * <p>Order is tech terms, then organization names, then product names. Identity entries are
   * skipped.
   *
   * @param customTerms configured dictionaries, may be null
   * @return literal rules, in dictionary order
   */
  public static List<CorrectionRule> customTermRules(CustomTerms customTerms) {
    if (customTerms == null) {
      return List.of();
    }

    List<CorrectionRule> rules = new ArrayList<>();
    for (TermEntry entry : customTerms.allEntries()) {
      if (entry.source().equals(entry.replacement())) {
        continue;
      }
      rules.add(CorrectionRule.literal(entry.source(), entry.replacement(), TECHNICAL_TERM));
    }
    return rules;
  }
}
