package com.scholary.lecture.corrector.segment;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.service.TranscriptWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptSegmenterTest {

  private TranscriptSegmenter segmenter;

  @BeforeEach
  void setUp() {
    segmenter = new TranscriptSegmenter();
  }

  @Test
  void split_shouldKeepHeaderOrderAndTrimText() {
    String raw =
        "[0:00:01 - 0:00:05]  最初の段落です  \n"
            + "[0:00:05 - 0:00:09]\n二番目\n\n"
            + "[0:00:09 - 0:00:12] 三番目";

    List<TranscriptBlock> blocks = segmenter.split(raw);

    assertThat(blocks)
        .containsExactly(
            new TranscriptBlock("0:00:01", "0:00:05", "最初の段落です"),
            new TranscriptBlock("0:00:05", "0:00:09", "二番目"),
            new TranscriptBlock("0:00:09", "0:00:12", "三番目"));
  }

  @Test
  void split_shouldIgnoreTextBeforeFirstHeader() {
    List<TranscriptBlock> blocks = segmenter.split("タイトル\n[0:00:01 - 0:00:05] 本文");

    assertThat(blocks).hasSize(1);
    assertThat(blocks.get(0).text()).isEqualTo("本文");
  }

  @Test
  void split_shouldDropBlankBlocks() {
    List<TranscriptBlock> blocks =
        segmenter.split("[0:00:01 - 0:00:05]   \n[0:00:05 - 0:00:09] 本文\n[0:00:09 - 0:00:10]\n");

    assertThat(blocks).extracting(TranscriptBlock::startTime).containsExactly("0:00:05");
  }

  @Test
  void split_shouldUseSentinelForMalformedHeader() {
    List<TranscriptBlock> blocks = segmenter.split("[1:2 - 3:4] 壊れたヘッダー\n[0:00:05 - 0:00:09] 正常");

    assertThat(blocks).hasSize(2);
    assertThat(blocks.get(0).startTime()).isEqualTo(TranscriptSegmenter.SENTINEL_TIME);
    assertThat(blocks.get(0).endTime()).isEqualTo(TranscriptSegmenter.SENTINEL_TIME);
    assertThat(blocks.get(0).text()).isEqualTo("壊れたヘッダー");
    assertThat(blocks.get(1).startTime()).isEqualTo("0:00:05");
  }

  @Test
  void split_shouldKeepBracketedNumberRangeInsideText() {
    List<TranscriptBlock> blocks = segmenter.split("[0:00:01 - 0:00:05] 配列の[0 - 9]の範囲を使います");

    assertThat(blocks)
        .containsExactly(new TranscriptBlock("0:00:01", "0:00:05", "配列の[0 - 9]の範囲を使います"));
  }

  @Test
  void split_shouldReturnEmptyForEmptyOrHeaderlessInput() {
    assertThat(segmenter.split(null)).isEmpty();
    assertThat(segmenter.split("")).isEmpty();
    assertThat(segmenter.split("ヘッダーのないテキスト")).isEmpty();
  }

  @Test
  void renderedTranscript_shouldSplitBackIntoSameBlocks() {
    List<TranscriptBlock> original =
        segmenter.split(
            "[0:00:01 - 0:00:05] 申します。\n[0:00:05 - 0:01:10] GPT と Llama\n[1:00:00 - 1:00:30] 以上です");

    List<Segment> segments = new ArrayList<>();
    for (TranscriptBlock block : original) {
      segments.add(
          new Segment(
              segments.size() + 1,
              block.startTime(),
              block.endTime(),
              block.text(),
              block.text(),
              List.of(),
              0.5,
              false));
    }

    String rendered = new TranscriptWriter(new ObjectMapper()).render(segments);

    assertThat(segmenter.split(rendered)).isEqualTo(original);
  }
}
