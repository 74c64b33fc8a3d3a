package com.titlesearch.pipeline.model;

import java.util.Locale;

public enum SearchPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    public boolean isExpedited() {
        return this == HIGH || this == URGENT;
    }

    public static SearchPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return SearchPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
