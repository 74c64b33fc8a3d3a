package com.titlesearch.pipeline.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

import static com.titlesearch.pipeline.recovery.RecoveryAction.ESCALATE;
import static com.titlesearch.pipeline.recovery.RecoveryAction.MANUAL_REVIEW;
import static com.titlesearch.pipeline.recovery.RecoveryAction.PARTIAL_COMPLETE;
import static com.titlesearch.pipeline.recovery.RecoveryAction.RETRY;
import static com.titlesearch.pipeline.recovery.RecoveryAction.RETRY_ALTERNATE;
import static com.titlesearch.pipeline.recovery.RecoveryAction.RETRY_WITH_DELAY;
import static com.titlesearch.pipeline.recovery.RecoveryAction.SKIP_STEP;

/**
 * Closed error taxonomy. Declaration order is the matching order used by {@link ErrorClassifier}.
 */
public enum ErrorCategory {
    NETWORK(Severity.MEDIUM, true, 30, 3, List.of(RETRY_WITH_DELAY, RETRY_ALTERNATE), true,
        "Network connectivity issue. Will retry automatically."),
    TIMEOUT(Severity.MEDIUM, true, 60, 2, List.of(RETRY_WITH_DELAY, SKIP_STEP), true,
        "Operation timed out. Will retry with extended timeout."),
    RATE_LIMIT(Severity.LOW, true, 300, 3, List.of(RETRY_WITH_DELAY), true,
        "Rate limited by county website. Will retry after delay."),
    AUTHENTICATION(Severity.HIGH, false, 0, 1, List.of(MANUAL_REVIEW, ESCALATE), false,
        "Authentication required. Please check credentials."),
    PARSING(Severity.HIGH, false, 0, 1, List.of(SKIP_STEP, PARTIAL_COMPLETE, MANUAL_REVIEW), true,
        "Unable to parse website response. Website may have changed."),
    SCRAPING(Severity.HIGH, false, 3600, 1, List.of(RETRY_ALTERNATE, MANUAL_REVIEW), false,
        "Unable to retrieve records from county website."),
    DATABASE(Severity.CRITICAL, true, 5, 5, List.of(RETRY, ESCALATE), true,
        "Database error. Retrying..."),
    STORAGE(Severity.HIGH, false, 60, 2, List.of(RETRY, ESCALATE), true,
        "File storage error. Please contact support."),
    EXTERNAL_SERVICE(Severity.MEDIUM, true, 30, 3, List.of(RETRY_WITH_DELAY, SKIP_STEP), true,
        "Document analysis service temporarily unavailable."),
    VALIDATION(Severity.MEDIUM, false, 0, 0, List.of(SKIP_STEP, MANUAL_REVIEW), true,
        "Invalid data encountered. Please review input."),
    RESOURCE(Severity.CRITICAL, true, 300, 1, List.of(RETRY_WITH_DELAY, ESCALATE), true,
        "System resources exhausted. Will retry later."),
    UNKNOWN(Severity.HIGH, false, 60, 1, List.of(RETRY, MANUAL_REVIEW), true,
        "An unexpected error occurred. Our team has been notified.");

    private final Severity severity;
    private final boolean transientError;
    private final long baseDelaySeconds;
    private final int maxRetries;
    private final List<RecoveryAction> actions;
    private final boolean resumable;
    private final String userMessage;

    ErrorCategory(
        Severity severity,
        boolean transientError,
        long baseDelaySeconds,
        int maxRetries,
        List<RecoveryAction> actions,
        boolean resumable,
        String userMessage
    ) {
        this.severity = severity;
        this.transientError = transientError;
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxRetries = maxRetries;
        this.actions = actions;
        this.resumable = resumable;
        this.userMessage = userMessage;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isTransient() {
        return transientError;
    }

    public long baseDelaySeconds() {
        return baseDelaySeconds;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public List<RecoveryAction> actions() {
        return actions;
    }

    /**
     * False for structural failures where replaying the pipeline against the same site cannot help.
     */
    public boolean isResumable() {
        return resumable;
    }

    public String userMessage() {
        return userMessage;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorCategory fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ErrorCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
