package com.scholary.lecture.corrector.audit;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.List;

/** Analysis of one original/corrected segment pair. */
public record SegmentAudit(
    int segmentId,
    String startTime,
    String endTime,
    int originalLength,
    int correctedLength,
    List<CorrectionCategory> corrections,
    double qualityScore,
    double readabilityImprovement,
    double textSimilarity,
    String originalPreview,
    String correctedPreview,
    List<String> significantChanges) {

  public SegmentAudit {
    corrections = List.copyOf(corrections);
    significantChanges = List.copyOf(significantChanges);
  }
}
