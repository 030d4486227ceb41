package com.scholary.lecture.corrector.api;

import com.scholary.lecture.corrector.audit.AuditReport;

/** Machine-readable analysis plus the same analysis as a text report. */
public record AuditResponse(AuditReport analysis, String report) {}
