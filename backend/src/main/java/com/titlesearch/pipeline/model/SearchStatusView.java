package com.titlesearch.pipeline.model;

import java.time.Instant;

public record SearchStatusView(
    long id,
    String referenceNumber,
    SearchStatus status,
    String statusMessage,
    int progressPercent,
    SearchPriority priority,
    int retryCount,
    int errorCount,
    Instant startedAt,
    Instant completedAt
) {
    public static SearchStatusView from(SearchJob job) {
        return new SearchStatusView(
            job.id(),
            job.referenceNumber(),
            job.status(),
            job.statusMessage(),
            job.progressPercent(),
            job.priority(),
            job.retryCount(),
            job.errorLog() == null ? 0 : job.errorLog().size(),
            job.startedAt(),
            job.completedAt()
        );
    }
}
