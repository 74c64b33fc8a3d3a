package com.titlesearch.pipeline.recovery;

import com.titlesearch.pipeline.model.DiagnosticEntry;

import java.util.List;

public record RecoverySuggestions(
    List<String> suggestions,
    boolean canRetry,
    ErrorSummary errorSummary,
    DiagnosticEntry latestError
) {
}
