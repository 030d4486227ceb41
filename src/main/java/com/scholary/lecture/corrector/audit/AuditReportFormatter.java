package com.scholary.lecture.corrector.audit;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders an {@link AuditReport} as a plain-text report for reviewers. */
@Component
public class AuditReportFormatter {

  static final int MAX_EXEMPLARS = 3;
  static final double EXEMPLAR_THRESHOLD = 0.7;

  public String format(AuditReport report) {
    List<SegmentAudit> segments = report.segments();
    if (segments.isEmpty()) {
      return "No segments could be analyzed.\n";
    }

    int total = segments.size();
    QualityDistribution distribution = report.qualityDistribution();
    OverallMetrics metrics = report.overallMetrics();

    StringBuilder out = new StringBuilder();
    out.append("Lecture correction quality report\n");
    out.append("=".repeat(60)).append("\n\n");

    out.append("Overall:\n");
    line(out, "Segments analyzed", String.valueOf(total));
    if (report.hasCountMismatch()) {
      line(
          out,
          "Unpaired segments",
          String.format(
              "%d (original %d, corrected %d)",
              report.unpairedSegments(),
              report.originalSegmentCount(),
              report.correctedSegmentCount()));
    }
    line(out, "Average quality", String.format("%.3f / 1.000", report.averageQuality()));
    line(
        out,
        "Average readability change",
        String.format("%.3f", report.averageReadabilityImprovement()));
    line(out, "Characters removed", String.format("%,d", metrics.characterReduction()));
    line(out, "Sentence count change", String.valueOf(metrics.sentenceCountChange()));
    line(
        out,
        "Punctuation density change",
        String.format("%.4f", metrics.punctuationDensityImprovement()));

    out.append("\nQuality distribution:\n");
    band(out, "Excellent (0.8+)", distribution.excellent(), total);
    band(out, "Good (0.6+)", distribution.good(), total);
    band(out, "Fair (0.4+)", distribution.fair(), total);
    band(out, "Poor", distribution.poor(), total);

    out.append("\nCorrections by category:\n");
    for (Map.Entry<String, Integer> entry : report.correctionTotals().entrySet()) {
      line(out, entry.getKey(), String.valueOf(entry.getValue()));
    }

    out.append("\nExemplary segments:\n");
    List<SegmentAudit> exemplars =
        segments.stream()
            .filter(s -> s.qualityScore() >= EXEMPLAR_THRESHOLD)
            .limit(MAX_EXEMPLARS)
            .collect(Collectors.toList());
    if (exemplars.isEmpty()) {
      out.append("  (none)\n");
    }
    for (SegmentAudit segment : exemplars) {
      out.append(
          String.format(
              "%n  Segment %d (quality %.3f) [%s - %s]%n",
              segment.segmentId(),
              segment.qualityScore(),
              segment.startTime(),
              segment.endTime()));
      out.append("     Changes: ")
          .append(
              segment.significantChanges().isEmpty()
                  ? "minor improvements"
                  : String.join(", ", segment.significantChanges()))
          .append('\n');
      out.append("     Before:  ").append(segment.originalPreview()).append('\n');
      out.append("     After:   ").append(segment.correctedPreview()).append('\n');
    }

    Evaluation evaluation = Evaluation.of(report.averageQuality());
    out.append("\nEvaluation:\n");
    line(out, "Rating", evaluation.rating);
    line(out, "Recommendation", evaluation.recommendation);
    line(
        out,
        "Good or better",
        String.format(
            "%.1f%%", percent(distribution.excellent() + distribution.good(), total)));

    return out.toString();
  }

  private static void line(StringBuilder out, String label, String value) {
    out.append("  - ").append(label).append(": ").append(value).append('\n');
  }

  private static void band(StringBuilder out, String label, int count, int total) {
    line(out, label, String.format("%d segments (%.1f%%)", count, percent(count, total)));
  }

  private static double percent(int count, int total) {
    return total == 0 ? 0.0 : count * 100.0 / total;
  }

  enum Evaluation {
    EXCELLENT(0.7, "excellent, production ready", "use as is"),
    GOOD(0.5, "good, usable", "minor tuning"),
    FAIR(0.3, "fair, room for improvement", "adjust configuration"),
    POOR(0.0, "needs improvement", "review the rule set");

    private final double minimum;
    private final String rating;
    private final String recommendation;

    Evaluation(double minimum, String rating, String recommendation) {
      this.minimum = minimum;
      this.rating = rating;
      this.recommendation = recommendation;
    }

    static Evaluation of(double averageQuality) {
      for (Evaluation evaluation : values()) {
        if (averageQuality >= evaluation.minimum) {
          return evaluation;
        }
      }
      return POOR;
    }
  }
}
