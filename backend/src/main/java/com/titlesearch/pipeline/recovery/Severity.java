package com.titlesearch.pipeline.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    WARNING,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Recorded for failures the chain deliberately carried on past. */
    public boolean isWarning() {
        return this == WARNING;
    }

    public boolean isHighOrCritical() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return HIGH;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
