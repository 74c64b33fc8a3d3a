package com.titlesearch.pipeline.model;

import java.time.Instant;

/** One CSV row of a batch, and the search it produced once processed. */
public record BatchItem(
    long id,
    long batchId,
    int lineNumber,
    String streetAddress,
    String city,
    String county,
    String state,
    String zipCode,
    String parcelNumber,
    Long searchId,
    BatchItemStatus status,
    String errorMessage,
    Instant processedAt
) {
}
