package com.titlesearch.pipeline.model;

public record PropertyTarget(
    long id,
    String streetAddress,
    String city,
    String county,
    String state,
    String zipCode,
    String parcelNumber
) {
    public boolean hasParcelNumber() {
        return parcelNumber != null && !parcelNumber.isBlank();
    }
}
