package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.segment.Segment;
import com.scholary.lecture.corrector.service.RunStatistics;
import java.util.List;

/** Corrected segments, the rendered transcript, and statistics of the run. */
public record CorrectionResponse(
    List<Segment> segments, String transcript, RunStatistics statistics) {}
