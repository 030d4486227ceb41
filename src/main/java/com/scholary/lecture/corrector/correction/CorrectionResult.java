package com.scholary.lecture.corrector.correction;

import java.util.List;

/** Text after the rule pipeline, plus one log entry per rule that matched. */
public record CorrectionResult(String text, List<CorrectionCategory> corrections) {

  public CorrectionResult {
    corrections = List.copyOf(corrections);
  }
}
