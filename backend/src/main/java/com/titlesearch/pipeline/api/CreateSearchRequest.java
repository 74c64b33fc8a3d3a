package com.titlesearch.pipeline.api;

public record CreateSearchRequest(
    String streetAddress,
    String city,
    String county,
    String state,
    String zipCode,
    String parcelNumber,
    String priority,
    Integer searchYears
) {
}
