package com.scholary.lecture.corrector.service;

import com.scholary.lecture.corrector.config.CostProperties;
import com.scholary.lecture.corrector.llm.RunAccounting;
import com.scholary.lecture.corrector.logging.StructuredLogger;
import com.scholary.lecture.corrector.segment.Segment;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Corrects every {@code *.txt} transcript of a directory.
 *
 * <p>Each input {@code name.txt} becomes {@code name_corrected.txt} in the output directory, and
 * {@code batch_statistics.json} summarizes the whole run. A file that cannot be read or written
 * is skipped and the rest of the batch continues. One {@link RunAccounting} covers the batch.
 */
@Service
public class BatchCorrectionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCorrectionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String STATISTICS_FILE = "batch_statistics.json";
  static final String OUTPUT_SUFFIX = "_corrected";

  private final TranscriptCorrectionService correctionService;
  private final TranscriptWriter writer;
  private final CostProperties costProperties;

  public BatchCorrectionService(
      TranscriptCorrectionService correctionService,
      TranscriptWriter writer,
      CostProperties costProperties) {
    this.correctionService = correctionService;
    this.writer = writer;
    this.costProperties = costProperties;
  }

  /**
   * Correct a directory.
   *
   * @param inputDir directory holding the transcripts
   * @param outputDir target directory, or null for {@code <inputDir>_corrected}
   * @param enableLlm whether flagged segments may be sent to the LLM
   * @return processed and skipped files with the batch statistics
   * @throws TranscriptIoException if the input directory cannot be listed or the output directory
   *     cannot be created
   */
  public BatchResult process(Path inputDir, Path outputDir, boolean enableLlm) {
    Path target = outputDir != null ? outputDir : defaultOutputDir(inputDir);
    List<Path> inputs = listTranscripts(inputDir);

    try {
      Files.createDirectories(target);
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to create output directory: " + target, e);
    }

    LOGGER.info(
        "Starting batch: files={}, inputDir={}, outputDir={}", inputs.size(), inputDir, target);

    RunAccounting accounting = new RunAccounting();
    List<Segment> allSegments = new ArrayList<>();
    List<String> processed = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    for (Path input : inputs) {
      String fileName = input.getFileName().toString();
      long start = System.currentTimeMillis();
      try {
        String content = writer.readTranscript(input);
        List<Segment> segments = correctionService.correct(content, enableLlm, accounting);
        writer.writeTranscript(target.resolve(correctedName(fileName)), segments);

        allSegments.addAll(segments);
        processed.add(fileName);

        STRUCTURED_LOGGER.logBatchFileProcessed(
            fileName,
            segments.size(),
            segments.stream().mapToDouble(Segment::qualityScore).average().orElse(0.0),
            segments.stream().filter(Segment::llmUsed).count(),
            System.currentTimeMillis() - start);
      } catch (TranscriptIoException e) {
        STRUCTURED_LOGGER.logBatchFileFailed(
            fileName, e.getClass().getSimpleName(), e.getMessage());
        failed.add(fileName);
      }
    }

    RunStatistics statistics = RunStatistics.of(allSegments, accounting, costProperties);
    writer.writeStatistics(target.resolve(STATISTICS_FILE), statistics);

    LOGGER.info(
        "Batch complete: processed={}, failed={}, segments={}, llmUsage={}, cost={}",
        processed.size(),
        failed.size(),
        statistics.totalSegments(),
        statistics.llmUsage(),
        String.format("%.2f", statistics.totalCost()));

    return new BatchResult(target.toString(), processed, failed, statistics);
  }

  static Path defaultOutputDir(Path inputDir) {
    Path absolute = inputDir.toAbsolutePath().normalize();
    return absolute.resolveSibling(absolute.getFileName() + OUTPUT_SUFFIX);
  }

  static String correctedName(String fileName) {
    return fileName.substring(0, fileName.length() - ".txt".length()) + OUTPUT_SUFFIX + ".txt";
  }

  private List<Path> listTranscripts(Path inputDir) {
    if (!Files.isDirectory(inputDir)) {
      throw new TranscriptIoException("Input directory not found: " + inputDir);
    }

    List<Path> inputs = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, "*.txt")) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          inputs.add(path);
        }
      }
    } catch (IOException e) {
      throw new TranscriptIoException("Failed to list input directory: " + inputDir, e);
    }
    Collections.sort(inputs);
    return inputs;
  }
}
