package com.scholary.lecture.corrector.api;

import jakarta.validation.constraints.NotNull;

public record AuditRequest(@NotNull String originalText, @NotNull String correctedText) {}
