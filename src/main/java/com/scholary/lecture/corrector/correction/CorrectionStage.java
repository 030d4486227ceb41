package com.scholary.lecture.corrector.correction;

/**
 * Stages of the rule pipeline, in execution order.
 *
 * <p>Order matters: punctuation insertion only recognizes verb endings that {@link #ENDING_FIXES}
 * has already completed, and normalization cleans up whitespace left by every earlier stage.
 */
public enum CorrectionStage {
  TECHNICAL_TERMS,
  ENDING_FIXES,
  REPETITION_REMOVAL,
  FILLER_REMOVAL,
  NATURALIZATION,
  PUNCTUATION,
  NORMALIZATION
}
