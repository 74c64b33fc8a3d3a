package com.titlesearch.pipeline.model;

import java.time.Instant;
import java.util.List;

public record SearchJob(
    long id,
    String referenceNumber,
    long propertyId,
    SearchStatus status,
    String statusMessage,
    int progressPercent,
    SearchPriority priority,
    int retryCount,
    List<DiagnosticEntry> errorLog,
    String externalTaskHandle,
    int searchYears,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
}
