package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.job.BatchJob.Status;
import com.scholary.lecture.corrector.service.BatchResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(String jobId, Status status, BatchResult result, String error) {}
