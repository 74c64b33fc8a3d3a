package com.titlesearch.pipeline.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecoveryAction {
    RETRY,
    RETRY_WITH_DELAY,
    RETRY_ALTERNATE,
    MANUAL_REVIEW,
    SKIP_STEP,
    PARTIAL_COMPLETE,
    ESCALATE,
    ABORT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecoveryAction fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL_REVIEW;
        }
        return RecoveryAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
