package com.titlesearch.pipeline.recovery;

import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.model.PipelineStep;

import java.util.List;

public record RecoveryOptions(
    boolean canRetry,
    String retryReason,
    PipelineStep resumeStep,
    List<String> suggestions,
    ErrorSummary errorSummary,
    DiagnosticEntry latestError,
    int progressSaved,
    List<ManualAction> actions
) {
}
