package com.titlesearch.pipeline.model;

import java.time.Instant;

public record BatchUpload(
    long id,
    String batchNumber,
    String originalFilename,
    BatchStatus status,
    int totalRecords,
    int processedRecords,
    int successfulRecords,
    int failedRecords,
    String errorMessage,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
}
