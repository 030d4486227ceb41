package com.scholary.lecture.corrector.api;

import jakarta.validation.constraints.NotNull;

/**
 * Request to correct one transcript.
 *
 * @param text transcript in the {@code [H:MM:SS - H:MM:SS]} block format
 * @param enableLlm whether flagged segments may go to the LLM (default true)
 */
public record CorrectionRequest(@NotNull String text, Boolean enableLlm) {

  public boolean llmRequested() {
    return enableLlm == null || enableLlm;
  }
}
