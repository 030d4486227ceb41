package com.scholary.lecture.corrector.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.config.CostProperties;
import com.scholary.lecture.corrector.correction.CorrectionCategory;
import com.scholary.lecture.corrector.llm.RunAccounting;
import com.scholary.lecture.corrector.segment.Segment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptWriterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TranscriptWriter writer;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    writer = new TranscriptWriter(objectMapper);
  }

  @Test
  void render_shouldWriteHeaderTextAndBlankLinePerSegment() {
    String rendered =
        writer.render(
            List.of(
                segment(1, "0:00:01", "0:00:05", "申します。", 0.8, false),
                segment(2, "0:00:05", "0:00:09", "GPTです。", 0.5, true)));

    assertThat(rendered)
        .isEqualTo("[0:00:01 - 0:00:05]\n申します。\n\n[0:00:05 - 0:00:09]\nGPTです。\n\n");
  }

  @Test
  void render_shouldBeEmptyForNoSegments() {
    assertThat(writer.render(List.of())).isEmpty();
  }

  @Test
  void writeStatisticsJson_shouldUseSnakeCaseFields() throws Exception {
    RunAccounting accounting = new RunAccounting();
    accounting.record(1000, 1000, 0.000035, 0.00014);
    RunStatistics statistics =
        RunStatistics.of(
            List.of(
                segment(1, "0:00:01", "0:00:05", "a", 0.9, true),
                segment(2, "0:00:05", "0:00:09", "b", 0.7, false)),
            accounting,
            new CostProperties(150, 100, 50, true),
            LocalDateTime.of(2024, 5, 1, 9, 30, 0));

    JsonNode json = objectMapper.readTree(writer.writeStatisticsJson(statistics));

    assertThat(json.get("total_segments").asInt()).isEqualTo(2);
    assertThat(json.get("llm_usage").asInt()).isEqualTo(1);
    assertThat(json.get("average_quality").asDouble()).isCloseTo(0.8, within(1e-9));
    assertThat(json.get("high_quality_count").asInt()).isEqualTo(1);
    assertThat(json.get("total_cost").asDouble()).isCloseTo(0.02625, within(1e-9));
    assertThat(json.get("input_tokens").asLong()).isEqualTo(1000);
    assertThat(json.get("output_tokens").asLong()).isEqualTo(1000);
    assertThat(json.get("processing_timestamp").asText()).isEqualTo("2024-05-01 09:30:00");
  }

  @Test
  void writeTranscript_shouldWriteUtf8File() throws Exception {
    Path target = tempDir.resolve("out.txt");

    writer.writeTranscript(target, List.of(segment(1, "0:00:01", "0:00:05", "講義", 0.5, false)));

    assertThat(Files.readString(target)).isEqualTo("[0:00:01 - 0:00:05]\n講義\n\n");
  }

  @Test
  void readTranscript_shouldReportMissingFile() {
    assertThatThrownBy(() -> writer.readTranscript(tempDir.resolve("missing.txt")))
        .isInstanceOf(TranscriptIoException.class)
        .hasMessageContaining("missing.txt");
  }

  private static Segment segment(
      int id, String start, String end, String text, double score, boolean llmUsed) {
    return new Segment(
        id, start, end, text, text, List.of(CorrectionCategory.PUNCTUATION), score, llmUsed);
  }
}
