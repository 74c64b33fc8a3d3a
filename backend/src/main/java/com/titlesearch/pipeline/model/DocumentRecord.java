package com.titlesearch.pipeline.model;

import java.time.Instant;
import java.time.LocalDate;

public record DocumentRecord(
    long id,
    long searchId,
    DocumentType documentType,
    DocumentSource source,
    String instrumentNumber,
    String bookPage,
    LocalDate recordingDate,
    String grantor,
    String grantee,
    String sourceUrl,
    String filePath,
    Long fileSize,
    String contentHash,
    String analysisSummary,
    boolean needsReview,
    Instant analyzedAt
) {
    public boolean isDownloaded() {
        return filePath != null && !filePath.isBlank();
    }

    public boolean isAnalyzed() {
        return analyzedAt != null;
    }
}
