package com.scholary.lecture.corrector.correction;

import static com.scholary.lecture.corrector.correction.CorrectionCategory.ENDING_FIX;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.FILLER_REMOVAL;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.NATURALIZATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.PUNCTUATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.REPETITION_REMOVAL;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.TECHNICAL_TERM;
import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.lecture.corrector.config.CorrectionProperties;
import com.scholary.lecture.corrector.config.CorrectionProperties.CustomTerms;
import com.scholary.lecture.corrector.config.CorrectionProperties.TermEntry;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RuleCorrectionPipelineTest {

  private RuleCorrectionPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline = new RuleCorrectionPipeline(CorrectionProperties.defaults());
  }

  @Test
  void correct_shouldRepairEndingsAndAddPunctuation() {
    CorrectionResult result = pipeline.correct("申しすございす");

    assertThat(result.text()).isEqualTo("申します。ございます。");
    assertThat(result.corrections()).containsExactly(ENDING_FIX, ENDING_FIX, PUNCTUATION);
  }

  @Test
  void correct_shouldRestoreDroppedLeadingCharacterOfThanks() {
    CorrectionResult result = pipeline.correct("りがとうございす");

    assertThat(result.text()).isEqualTo("ありがとうございます。");
    assertThat(result.corrections()).containsExactly(ENDING_FIX, PUNCTUATION);
  }

  @Test
  void correct_shouldNotPunctuateBeforeConjunction() {
    CorrectionResult result = pipeline.correct("思いますが違います");

    assertThat(result.text()).isEqualTo("思いますが違います");
    assertThat(result.corrections()).isEmpty();
  }

  @Test
  void correct_shouldReplaceStandaloneBeruto() {
    CorrectionResult result = pipeline.correct("ベルトの論文");

    assertThat(result.text()).isEqualTo("ベルトンの論文");
    assertThat(result.corrections()).containsExactly(TECHNICAL_TERM);
  }

  @Test
  void correct_shouldLeaveLongerKatakanaWordAlone() {
    assertThat(pipeline.correct("ベルトコンベア").text()).isEqualTo("ベルトコンベア");
  }

  @Test
  void correct_shouldReplaceGptReading() {
    CorrectionResult result = pipeline.correct("ジーピーティーを使う");

    assertThat(result.text()).isEqualTo("GPTを使う");
    assertThat(result.corrections()).containsExactly(TECHNICAL_TERM);
  }

  @Test
  void correct_shouldNotExtendAlreadyCorrectedLabName() {
    assertThat(pipeline.correct("松尾研究室の講義").text()).isEqualTo("松尾研究室の講義");
    assertThat(pipeline.correct("松尾研の講義").text()).isEqualTo("松尾研究室の講義");
  }

  @Test
  void correct_shouldCollapseDuplicatedPhrase() {
    CorrectionResult result = pipeline.correct("Day2になるDay2の講座");

    assertThat(result.text()).isEqualTo("Day2の講座");
    assertThat(result.corrections()).containsExactly(REPETITION_REMOVAL);
  }

  @Test
  void correct_shouldCollapseRepeatedWords() {
    CorrectionResult result = pipeline.correct("それでは それでは 始めます");

    assertThat(result.text()).isEqualTo("それでは 始めます");
    assertThat(result.corrections()).containsExactly(REPETITION_REMOVAL);
  }

  @Test
  void correct_shouldRemoveLeadingFiller() {
    CorrectionResult result = pipeline.correct("えー、今日は講義です");

    assertThat(result.text()).isEqualTo("今日は講義です");
    assertThat(result.corrections()).containsExactly(FILLER_REMOVAL);
  }

  @Test
  void correct_shouldNaturalizeColloquialQuote() {
    CorrectionResult result = pipeline.correct("モデルっていう仕組み");

    assertThat(result.text()).isEqualTo("モデルという仕組み");
    assertThat(result.corrections()).containsExactly(NATURALIZATION);
  }

  @Test
  void correct_shouldNormalizeWhitespaceWithoutLogging() {
    CorrectionResult result = pipeline.correct("  今日は   晴れ  ");

    assertThat(result.text()).isEqualTo("今日は 晴れ");
    assertThat(result.corrections()).isEmpty();
  }

  @Test
  void correct_shouldSkipDisabledStages() {
    RuleCorrectionPipeline endingsOnly =
        new RuleCorrectionPipeline(
            CorrectionRules.defaults(), List.of(), EnumSet.of(CorrectionStage.ENDING_FIXES));

    CorrectionResult result = endingsOnly.correct("申しすございす ジーピーティー");

    assertThat(result.text()).isEqualTo("申しますございます ジーピーティー");
    assertThat(result.corrections()).containsExactly(ENDING_FIX, ENDING_FIX);
  }

  @Test
  void correct_shouldReturnInputWhenAllStagesDisabled() {
    RuleCorrectionPipeline none =
        new RuleCorrectionPipeline(
            CorrectionRules.defaults(), List.of(), EnumSet.noneOf(CorrectionStage.class));

    CorrectionResult result = none.correct("申しす");

    assertThat(result.text()).isEqualTo("申しす");
    assertThat(result.corrections()).isEmpty();
  }

  @Test
  void correct_shouldApplyCustomTermsInTechnicalStage() {
    List<CorrectionRule> custom =
        CorrectionRules.customTermRules(
            new CustomTerms(
                List.of(),
                List.of(new TermEntry("松尾岩澤研", "松尾・岩澤研")),
                List.of(new TermEntry("Googleコラボ", "Google Colab"))));
    RuleCorrectionPipeline withCustom =
        new RuleCorrectionPipeline(
            CorrectionRules.defaults(), custom, EnumSet.allOf(CorrectionStage.class));

    CorrectionResult result = withCustom.correct("松尾岩澤研のGoogleコラボ");

    assertThat(result.text()).isEqualTo("松尾・岩澤研のGoogle Colab");
    assertThat(result.corrections()).containsExactly(TECHNICAL_TERM, TECHNICAL_TERM);
  }

  @Test
  void runStage_shouldRunSingleStageEvenWhenDisabled() {
    RuleCorrectionPipeline none =
        new RuleCorrectionPipeline(
            CorrectionRules.defaults(), List.of(), EnumSet.noneOf(CorrectionStage.class));

    CorrectionResult result = none.runStage(CorrectionStage.TECHNICAL_TERMS, "エルエルエムの話");

    assertThat(result.text()).isEqualTo("LLMの話");
    assertThat(result.corrections()).containsExactly(TECHNICAL_TERM);
  }
}
