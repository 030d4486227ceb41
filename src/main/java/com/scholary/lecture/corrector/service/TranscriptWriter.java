package com.scholary.lecture.corrector.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.segment.Segment;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes corrected transcripts and run statistics.
 *
 * <p>Transcript format, one block per segment in source order:
 *
 * <pre>
 * [0:00:01 - 0:00:05]
 * 申します。ございます。
 *
 * </pre>
 *
 * <p>The output reads back through the segmenter into the same timestamps and text.
 */
@Component
public class TranscriptWriter {

  private final ObjectMapper objectMapper;

  public TranscriptWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String render(List<Segment> segments) {
    StringBuilder out = new StringBuilder();
    for (Segment segment : segments) {
      out.append('[')
          .append(segment.startTime())
          .append(" - ")
          .append(segment.endTime())
          .append("]\n");
      out.append(segment.correctedText()).append("\n\n");
    }
    return out.toString();
  }

  public void writeTranscript(Path target, List<Segment> segments) {
    try {
      Files.writeString(target, render(segments), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to write transcript: " + target, e);
    }
  }

  public byte[] writeStatisticsJson(RunStatistics statistics) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(statistics);
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to serialize run statistics", e);
    }
  }

  public void writeStatistics(Path target, RunStatistics statistics) {
    try {
      Files.write(target, writeStatisticsJson(statistics));
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to write statistics: " + target, e);
    }
  }

  /**
   * Read a UTF-8 transcript.
   *
   * @throws TranscriptIoException if the file cannot be read
   */
  public String readTranscript(Path source) {
    try {
      return Files.readString(source, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to read transcript: " + source, e);
    }
  }
}
