package com.scholary.lecture.corrector.job;

import com.scholary.lecture.corrector.job.BatchJob.Status;
import com.scholary.lecture.corrector.logging.StructuredLogger;
import com.scholary.lecture.corrector.service.BatchCorrectionService;
import com.scholary.lecture.corrector.service.BatchResult;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Runs batch jobs on the async executor and records their outcome. */
@Service
public class BatchJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchJobRunner.class);

  private final BatchCorrectionService batchService;
  private final JobRepository jobRepository;

  public BatchJobRunner(BatchCorrectionService batchService, JobRepository jobRepository) {
    this.batchService = batchService;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>Runs on the {@code taskExecutor} pool. Any failure marks the job FAILED with its message.
   */
  @Async
  public void run(BatchJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getInputDir());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      Path outputDir = job.getOutputDir() != null ? Path.of(job.getOutputDir()) : null;
      BatchResult result =
          batchService.process(Path.of(job.getInputDir()), outputDir, job.isEnableLlm());

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setError(e.getMessage());
      job.setStatus(Status.FAILED);
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
