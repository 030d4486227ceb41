package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.job.BatchJob;
import com.scholary.lecture.corrector.job.BatchJobRunner;
import com.scholary.lecture.corrector.job.JobRepository;
import com.scholary.lecture.corrector.service.BatchPathResolver;
import com.scholary.lecture.corrector.service.InvalidBatchPathException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batch correction.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a batch over a directory below the batch root (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Batch", description = "Directory batch correction API")
public class BatchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchController.class);

  private final BatchJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final BatchPathResolver pathResolver;

  public BatchController(
      BatchJobRunner jobRunner, JobRepository jobRepository, BatchPathResolver pathResolver) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.pathResolver = pathResolver;
  }

  @PostMapping("/batches")
  @Operation(
      summary = "Start batch correction",
      description = "Start an asynchronous batch job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> startBatch(@Valid @RequestBody BatchRequest request) {
    String jobId = UUID.randomUUID().toString();
    try {
      LOGGER.info(
          "Batch request: inputDir={}, outputDir={}", request.inputDir(), request.outputDir());

      Path inputDir = pathResolver.resolve(request.inputDir());
      Path outputDir =
          request.outputDir() != null ? pathResolver.resolve(request.outputDir()) : null;

      BatchJob job =
          new BatchJob(
              jobId,
              inputDir.toString(),
              outputDir != null ? outputDir.toString() : null,
              request.llmRequested());
      jobRepository.save(job);

      LOGGER.info("Created async batch job: {}", jobId);
      jobRunner.run(job);

      return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
    } catch (InvalidBatchPathException e) {
      LOGGER.warn("Rejected batch request: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (RuntimeException e) {
      LOGGER.error("Failed to start batch job", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /** Returns the current state of a batch job, with its result once completed. */
  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a batch job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(), job.getStatus(), job.getResult(), job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
