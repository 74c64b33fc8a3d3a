package com.titlesearch.pipeline.queue;

/**
 * An awaited task finished without a result. The message carries the task's own error text so the
 * waiting stage classifies the underlying failure, not the wait.
 */
public class TaskFailedException extends RuntimeException {
    public TaskFailedException(String message) {
        super(message);
    }
}
