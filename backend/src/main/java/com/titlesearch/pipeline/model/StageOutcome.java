package com.titlesearch.pipeline.model;

/**
 * Result of one step or child task. Stored as JSON on the task row and returned by the queue.
 */
public record StageOutcome(String status, int total, int succeeded, int failed, String message) {
    public static final String SUCCESS = "success";
    public static final String SKIPPED = "skipped";
    public static final String FAILED = "failed";

    public static StageOutcome success(int total, int succeeded, int failed, String message) {
        return new StageOutcome(SUCCESS, total, succeeded, failed, message);
    }

    public static StageOutcome success(String message) {
        return new StageOutcome(SUCCESS, 0, 0, 0, message);
    }

    public static StageOutcome skipped(String message) {
        return new StageOutcome(SKIPPED, 0, 0, 0, message);
    }

    public static StageOutcome failed(String message) {
        return new StageOutcome(FAILED, 0, 0, 0, message);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
