package com.scholary.lecture.corrector.segment;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.List;

/**
 * A fully processed transcript segment.
 *
 * <p>Created once per non-empty {@link TranscriptBlock}, after rule correction, scoring and the
 * optional LLM pass have all run. Ids start at 1 and have no gaps.
 */
public record Segment(
    int id,
    String startTime,
    String endTime,
    String originalText,
    String correctedText,
    List<CorrectionCategory> appliedCorrections,
    double qualityScore,
    boolean llmUsed) {

  public Segment {
    if (id < 1) {
      throw new IllegalArgumentException("Segment id must be >= 1");
    }
    appliedCorrections = List.copyOf(appliedCorrections);
    qualityScore = Math.min(1.0, Math.max(0.0, qualityScore));
  }
}
