package com.scholary.lecture.corrector.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentTest {

  @Test
  void constructor_shouldClampQualityScore() {
    assertThat(segment(1.4).qualityScore()).isEqualTo(1.0);
    assertThat(segment(-0.2).qualityScore()).isEqualTo(0.0);
  }

  @Test
  void constructor_shouldRejectNonPositiveId() {
    assertThatThrownBy(
            () -> new Segment(0, "0:00:00", "0:00:01", "a", "a", List.of(), 0.5, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Segment segment(double score) {
    return new Segment(
        1, "0:00:00", "0:00:01", "a", "b", List.of(CorrectionCategory.PUNCTUATION), score, false);
  }
}
