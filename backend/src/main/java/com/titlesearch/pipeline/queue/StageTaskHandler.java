package com.titlesearch.pipeline.queue;

import com.titlesearch.pipeline.model.StageOutcome;

public interface StageTaskHandler {
    String taskName();

    /** Queue-level retries allowed after the first execution. */
    int maxRetries();

    StageOutcome handle(StageTask task) throws Exception;

    /**
     * Called once per failed execution, before the worker reschedules or fails the row.
     * {@code willRetry} is false on the last one.
     */
    default void onFailure(StageTask task, String error, boolean willRetry) {
    }
}
