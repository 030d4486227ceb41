package com.scholary.lecture.corrector.audit;

import java.util.List;
import java.util.Map;

/**
 * Machine-readable result of comparing an original and a corrected transcript.
 *
 * <p>Segments are paired by position. When the two transcripts have different segment counts,
 * only the first {@code min} pairs are analyzed and {@code unpairedSegments} says how many were
 * left out.
 */
public record AuditReport(
    int originalSegmentCount,
    int correctedSegmentCount,
    int unpairedSegments,
    OverallMetrics overallMetrics,
    List<SegmentAudit> segments,
    Map<String, Integer> correctionTotals,
    QualityDistribution qualityDistribution,
    double averageQuality,
    double averageReadabilityImprovement) {

  public AuditReport {
    segments = List.copyOf(segments);
  }

  public boolean hasCountMismatch() {
    return unpairedSegments > 0;
  }
}
