package com.titlesearch.pipeline.queue;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import com.titlesearch.pipeline.recovery.RetryDecision;
import org.springframework.stereotype.Component;

/**
 * Queue-level retry: the classifier's exponential backoff, bounded by the handler's own limit and
 * capped at the configured maximum delay.
 */
@Component
public class StageRetryPolicy {
    private final ErrorClassifier classifier;
    private final PipelineProperties properties;

    public StageRetryPolicy(ErrorClassifier classifier, PipelineProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    public RetryDecision decide(String error, int attempts, int maxRetries) {
        if (maxRetries <= 0) {
            return RetryDecision.NO_RETRY;
        }
        RetryDecision decision = classifier.shouldRetry(error, attempts, maxRetries);
        if (!decision.retry()) {
            return decision;
        }
        long cap = properties.getQueue().getMaxRetryDelaySeconds();
        return new RetryDecision(true, Math.min(decision.delaySeconds(), cap));
    }
}
