package com.scholary.lecture.corrector.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.lecture.corrector.segment.TranscriptSegmenter;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuditReportFormatterTest {

  private final DiffAnalyzer analyzer =
      new DiffAnalyzer(new TranscriptSegmenter(), new CorrectionDetector(List.of()));
  private final AuditReportFormatter formatter = new AuditReportFormatter();

  @Test
  void format_shouldListHighQualitySegmentsAsExemplars() {
    AuditReport report =
        analyzer.analyze(
            "[0:00:01 - 0:00:05] 今日はDay2になるDay2の講座です",
            "[0:00:01 - 0:00:05] 今日はDay2の講座です");

    String text = formatter.format(report);

    assertThat(text).contains("Segments analyzed: 1");
    assertThat(text).contains("Segment 1 (quality");
    assertThat(text).contains("duplicate phrase removed");
    assertThat(text).contains("Rating: excellent");
    assertThat(text).doesNotContain("Unpaired segments");
  }

  @Test
  void format_shouldListAtMostThreeExemplars() {
    StringBuilder original = new StringBuilder();
    StringBuilder corrected = new StringBuilder();
    for (int i = 1; i <= 5; i++) {
      String header = "[0:00:0" + i + " - 0:00:0" + (i + 1) + "] ";
      original.append(header).append("今日はDay2になるDay2の講座です\n");
      corrected.append(header).append("今日はDay2の講座です\n");
    }

    String text = formatter.format(analyzer.analyze(original.toString(), corrected.toString()));

    assertThat(text).contains("Segment 3 (quality").doesNotContain("Segment 4 (quality");
  }

  @Test
  void format_shouldMentionUnpairedSegments() {
    AuditReport report =
        analyzer.analyze("[0:00:01 - 0:00:05] 一\n[0:00:05 - 0:00:09] 二", "[0:00:01 - 0:00:05] 一");

    assertThat(formatter.format(report)).contains("Unpaired segments: 1");
  }

  @Test
  void format_shouldHandleEmptyReport() {
    assertThat(formatter.format(analyzer.analyze("", ""))).isEqualTo("No segments could be analyzed.\n");
  }
}
