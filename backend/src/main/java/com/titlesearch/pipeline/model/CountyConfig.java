package com.titlesearch.pipeline.model;

import java.time.Instant;

public record CountyConfig(
    long id,
    String countyName,
    String state,
    String recorderUrl,
    String courtRecordsUrl,
    String scrapingAdapter,
    int requestsPerMinute,
    int delayBetweenRequestsMs,
    boolean scrapingEnabled,
    boolean healthy,
    int consecutiveFailures,
    Instant lastSuccessfulScrape,
    Instant lastFailedScrape
) {
}
