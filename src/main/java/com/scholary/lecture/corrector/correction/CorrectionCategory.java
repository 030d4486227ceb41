package com.scholary.lecture.corrector.correction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of correction applied to a segment.
 *
 * <p>The label is what appears in correction logs, reports and JSON output.
 */
public enum CorrectionCategory {
  TECHNICAL_TERM("technical term"),
  ENDING_FIX("ending fix"),
  REPETITION_REMOVAL("repetition removal"),
  FILLER_REMOVAL("filler removal"),
  NATURALIZATION("naturalization"),
  PUNCTUATION("punctuation"),
  CONTEXT_CORRECTION("context correction"),
  // Whitespace cleanup; never written to a correction log
  NORMALIZATION("normalization");

  private final String label;

  CorrectionCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isLogged() {
    return this != NORMALIZATION;
  }

  @Override
  public String toString() {
    return label;
  }
}
