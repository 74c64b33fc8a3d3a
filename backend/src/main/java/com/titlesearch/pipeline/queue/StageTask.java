package com.titlesearch.pipeline.queue;

import java.time.Instant;

/**
 * One row of the task queue. {@code attempts} counts failed executions that were rescheduled; it is
 * independent of the search job's own resumption counter.
 */
public record StageTask(
    long id,
    String taskName,
    String queueName,
    long searchId,
    Long itemId,
    String payload,
    TaskState state,
    int attempts,
    Instant nextRunAt,
    String lockOwner,
    String resultJson,
    String lastError,
    Instant createdAt,
    Instant finishedAt
) {
    public String handle() {
        return String.valueOf(id);
    }
}
