package com.scholary.lecture.corrector.api;

/** Response for an async batch request. The job ID can be used to poll for status. */
public record AsyncJobResponse(String jobId) {}
