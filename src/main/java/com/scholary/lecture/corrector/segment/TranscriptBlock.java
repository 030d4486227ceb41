package com.scholary.lecture.corrector.segment;

/**
 * One timestamped unit of raw transcript text, as found between two headers.
 *
 * <p>Timestamps are the strings found in the header (for example {@code 0:00:27}) and are written
 * back unchanged.
 */
public record TranscriptBlock(String startTime, String endTime, String text) {}
