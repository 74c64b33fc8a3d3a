package com.titlesearch.pipeline.recovery;

public record RetryDecision(boolean retry, long delaySeconds) {
    public static final RetryDecision NO_RETRY = new RetryDecision(false, 0);
}
