package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.audit.AuditReport;
import com.scholary.lecture.corrector.audit.AuditReportFormatter;
import com.scholary.lecture.corrector.audit.DiffAnalyzer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for comparing an original transcript with its corrected version. */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Audit", description = "Correction quality analysis")
public class AuditController {

  private final DiffAnalyzer analyzer;
  private final AuditReportFormatter formatter;

  public AuditController(DiffAnalyzer analyzer, AuditReportFormatter formatter) {
    this.analyzer = analyzer;
    this.formatter = formatter;
  }

  @PostMapping("/audits")
  @Operation(
      summary = "Audit a correction",
      description =
          "Pair segments by position and report detected corrections, quality distribution "
              + "and whole-transcript metrics.")
  public ResponseEntity<AuditResponse> audit(@Valid @RequestBody AuditRequest request) {
    AuditReport report = analyzer.analyze(request.originalText(), request.correctedText());
    return ResponseEntity.ok(new AuditResponse(report, formatter.format(report)));
  }
}
