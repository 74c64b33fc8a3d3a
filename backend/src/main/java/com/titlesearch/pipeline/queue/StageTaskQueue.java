package com.titlesearch.pipeline.queue;

import com.titlesearch.pipeline.model.StageOutcome;

import java.time.Duration;

/**
 * Distributed queue the pipeline submits its units of work to. Handles are opaque strings so the
 * search row can store whichever one is currently outstanding.
 */
public interface StageTaskQueue {
    String submit(String taskName, long searchId, Long itemId, String payload, String queueName, Duration delay);

    /**
     * Blocks until the task finishes.
     *
     * @throws TaskFailedException when the task failed for good or was revoked
     * @throws TaskTimeoutException when {@code timeout} elapses first
     */
    StageOutcome getResult(String handle, Duration timeout);

    /** Best effort: a task that is already running keeps running. */
    boolean revoke(String handle);
}
