package com.scholary.lecture.corrector.config;

import com.scholary.lecture.corrector.correction.CorrectionStage;
import com.scholary.lecture.corrector.scoring.ScoringVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript correction.
 *
 * <p>Controls which pipeline stages run, how segments are scored, when segments are escalated to
 * the LLM, extra term dictionaries, and the batch executor.
 */
@ConfigurationProperties(prefix = "corrector")
@Validated
public record CorrectionProperties(
    @Valid @NotNull StageProperties stages,
    @NotNull ScoringVariant scoring,
    @Valid @NotNull EscalationProperties escalation,
    @Valid CustomTerms customTerms,
    @Valid @NotNull BatchProperties batch) {

  /** Everything enabled, weighted scoring, built-in dictionaries only. */
  public static CorrectionProperties defaults() {
    return new CorrectionProperties(
        StageProperties.allEnabled(),
        ScoringVariant.WEIGHTED,
        new EscalationProperties(true, 1.0, 0.3),
        new CustomTerms(List.of(), List.of(), List.of()),
        new BatchProperties(2, 10, "transcripts"));
  }

  public record StageProperties(
      boolean technicalTerms,
      boolean endingFixes,
      boolean repetitionRemoval,
      boolean fillerRemoval,
      boolean naturalization,
      boolean punctuation,
      boolean normalization) {

    public static StageProperties allEnabled() {
      return new StageProperties(true, true, true, true, true, true, true);
    }

    public Set<CorrectionStage> enabledStages() {
      Set<CorrectionStage> enabled = EnumSet.noneOf(CorrectionStage.class);
      if (technicalTerms) {
        enabled.add(CorrectionStage.TECHNICAL_TERMS);
      }
      if (endingFixes) {
        enabled.add(CorrectionStage.ENDING_FIXES);
      }
      if (repetitionRemoval) {
        enabled.add(CorrectionStage.REPETITION_REMOVAL);
      }
      if (fillerRemoval) {
        enabled.add(CorrectionStage.FILLER_REMOVAL);
      }
      if (naturalization) {
        enabled.add(CorrectionStage.NATURALIZATION);
      }
      if (punctuation) {
        enabled.add(CorrectionStage.PUNCTUATION);
      }
      if (normalization) {
        enabled.add(CorrectionStage.NORMALIZATION);
      }
      return enabled;
    }
  }

  /**
   * When flagged segments go to the LLM.
   *
   * @param enabled master switch for escalation
   * @param useThreshold a flagged segment is escalated only if its rule score is at most this
   * @param qualityBoost added to the score when the LLM changes the text
   */
  public record EscalationProperties(
      boolean enabled,
      @DecimalMin("0.0") @DecimalMax("1.0") double useThreshold,
      @DecimalMin("0.0") @DecimalMax("1.0") double qualityBoost) {}

  /** Extra literal term rewrites, appended to the technical-term stage. */
  public record CustomTerms(
      @Valid List<TermEntry> techTerms,
      @Valid List<TermEntry> organizationNames,
      @Valid List<TermEntry> productNames) {

    public List<TermEntry> allEntries() {
      List<TermEntry> all = new ArrayList<>();
      if (techTerms != null) {
        all.addAll(techTerms);
      }
      if (organizationNames != null) {
        all.addAll(organizationNames);
      }
      if (productNames != null) {
        all.addAll(productNames);
      }
      return all;
    }
  }

  public record TermEntry(@NotBlank String source, @NotBlank String replacement) {}

  /**
   * Batch job settings.
   *
   * @param asyncExecutorThreads worker threads for batch jobs
   * @param asyncExecutorQueueSize jobs waiting for a worker
   * @param root base directory; batch input and output directories must lie inside it
   */
  public record BatchProperties(
      @Positive int asyncExecutorThreads,
      @Positive int asyncExecutorQueueSize,
      @NotBlank String root) {}
}
