package com.titlesearch.pipeline.queue;

public enum TaskState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    REVOKED
}
