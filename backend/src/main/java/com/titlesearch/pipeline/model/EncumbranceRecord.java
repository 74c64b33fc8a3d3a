package com.titlesearch.pipeline.model;

import java.time.LocalDate;

public record EncumbranceRecord(
    long id,
    long searchId,
    Long documentId,
    EncumbranceType encumbranceType,
    String status,
    String holder,
    LocalDate recordingDate,
    String description
) {
    public static final String ACTIVE = "ACTIVE";
    public static final String RELEASED = "RELEASED";

    public boolean isActive() {
        return ACTIVE.equals(status);
    }
}
