package com.scholary.lecture.corrector.llm;

import org.springframework.stereotype.Component;

/**
 * Builds the correction instruction sent to the LLM.
 *
 * <p>The prompt is in Japanese, like the transcripts. It names the domain, lists exactly four
 * kinds of fixes with examples, asks for minimal meaning-preserving edits, and ends with the text
 * to correct.
 */
@Component
public class CorrectionPromptBuilder {

  private static final String HEADER =
      "以下は大規模言語モデル（LLM）講座の講義を音声認識で書き起こしたテキストです。"
          + "音声認識による誤りを修正し、正確で自然な日本語にしてください。\n\n";

  private static final String RULES =
      "【修正の種類】\n"
          + "1. 専門用語・人名・組織名の修正\n"
          + "   例: 「松尾岩澤研」→「松尾・岩澤研」、「Googleコラボ」→「Google Colab」、"
          + "「スレッド1」→「ワンスレッド1」\n"
          + "2. 音の似た語の誤認識の修正\n"
          + "   例: 「帰漏らし」→「聞き漏らし」、「簡易回」→「範囲外」、「バット」→「バッド」、"
          + "「円周部分」→「演習部分」\n"
          + "3. 文脈に依存する語句の修正\n"
          + "   例: 「とも配も」→文脈に応じて「ともかく」または「この後」、"
          + "「お腹切り取りたい」→「可能な限り取りたい」\n"
          + "4. 話し言葉から書き言葉への自然化\n"
          + "   例: 冗長な繰り返しや口語表現を整える\n\n";

  private static final String CONSTRAINTS =
      "【注意】\n"
          + "- 元の意味を変えないこと\n"
          + "- 講義の文脈に合った修正にすること\n"
          + "- 修正は必要最小限にとどめること\n\n";

  private static final String FOOTER = "\n\n【修正後】（修正後のテキストのみを出力してください）:";

  /**
   * Build the instruction for one segment.
   *
   * @param text the rule-corrected segment text
   * @return the full prompt
   */
  public String build(String text) {
    return HEADER + RULES + CONSTRAINTS + "【修正対象テキスト】\n" + text + FOOTER;
  }
}
