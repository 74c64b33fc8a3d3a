package com.titlesearch.pipeline.recovery;

import java.util.Map;

public record ErrorSummary(
    int totalErrors,
    Map<ErrorCategory, Integer> byCategory,
    ErrorCategory mostCommon,
    int consecutiveFailures
) {
}
