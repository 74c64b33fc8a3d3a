package com.titlesearch.pipeline.model;

import java.time.Instant;

public record TitleReportSummary(
    long id,
    long searchId,
    String reportNumber,
    int riskScore,
    String riskLevel,
    String summary,
    Instant generatedAt
) {
}
