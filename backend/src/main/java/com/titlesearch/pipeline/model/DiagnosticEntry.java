package com.titlesearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.titlesearch.pipeline.recovery.ErrorCategory;
import com.titlesearch.pipeline.recovery.RecoveryAction;
import com.titlesearch.pipeline.recovery.Severity;

import java.time.Instant;

public record DiagnosticEntry(
    Instant timestamp,
    String stage,
    String error,
    ErrorCategory category,
    Severity severity,
    @JsonProperty("transient") boolean transientError,
    RecoveryAction recommendedAction
) {
}
