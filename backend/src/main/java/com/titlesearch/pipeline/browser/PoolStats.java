package com.titlesearch.pipeline.browser;

public record PoolStats(
    int capacity,
    int size,
    int inUse,
    int idle,
    int temporaryInUse,
    boolean initialized
) {
}
