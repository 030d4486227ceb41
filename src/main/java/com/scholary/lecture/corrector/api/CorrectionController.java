package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.config.CostProperties;
import com.scholary.lecture.corrector.llm.RunAccounting;
import com.scholary.lecture.corrector.segment.Segment;
import com.scholary.lecture.corrector.service.CorrectionCancelledException;
import com.scholary.lecture.corrector.service.RunStatistics;
import com.scholary.lecture.corrector.service.TranscriptCorrectionService;
import com.scholary.lecture.corrector.service.TranscriptWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for correcting a single transcript synchronously. */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Correction", description = "Lecture transcript correction API")
public class CorrectionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionController.class);

  private final TranscriptCorrectionService correctionService;
  private final TranscriptWriter writer;
  private final CostProperties costProperties;

  public CorrectionController(
      TranscriptCorrectionService correctionService,
      TranscriptWriter writer,
      CostProperties costProperties) {
    this.correctionService = correctionService;
    this.writer = writer;
    this.costProperties = costProperties;
  }

  @PostMapping("/corrections")
  @Operation(
      summary = "Correct a transcript",
      description =
          "Apply the rule pipeline to every timestamped block, escalate flagged blocks to the "
              + "LLM when enabled, and return scored segments with run statistics.")
  public ResponseEntity<CorrectionResponse> correct(
      @Valid @RequestBody CorrectionRequest request) {
    LOGGER.info(
        "Correction request: chars={}, enableLlm={}",
        request.text().length(),
        request.llmRequested());

    try {
      RunAccounting accounting = new RunAccounting();
      List<Segment> segments =
          correctionService.correct(request.text(), request.llmRequested(), accounting);

      return ResponseEntity.ok(
          new CorrectionResponse(
              segments,
              writer.render(segments),
              RunStatistics.of(segments, accounting, costProperties)));

    } catch (CorrectionCancelledException e) {
      LOGGER.warn("Correction cancelled: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }
}
