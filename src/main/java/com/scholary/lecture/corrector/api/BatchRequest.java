package com.scholary.lecture.corrector.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to correct every transcript in a directory.
 *
 * @param inputDir directory of {@code *.txt} transcripts, absolute or relative to the batch root
 * @param outputDir target directory below the batch root, defaults to {@code <inputDir>_corrected}
 * @param enableLlm whether flagged segments may go to the LLM (default true)
 */
public record BatchRequest(@NotBlank String inputDir, String outputDir, Boolean enableLlm) {

  public boolean llmRequested() {
    return enableLlm == null || enableLlm;
  }
}
