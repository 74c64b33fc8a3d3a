package com.titlesearch.pipeline.recovery;

import java.util.List;

public record ErrorDiagnosis(
    ErrorCategory category,
    Severity severity,
    boolean transientError,
    long retryDelaySeconds,
    int remainingRetries,
    List<RecoveryAction> actions,
    RecoveryAction recommendedAction,
    String userMessage,
    String technicalDetails,
    String stage,
    int retryCount
) {
}
