package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.queue.StageTaskQueue;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches one child task per item and joins on each with a per-item timeout. Item failures are
 * counted; only a stage where every item failed is itself a failure.
 */
@Component
public class ChildTaskFanOut {
    private static final Logger log = LoggerFactory.getLogger(ChildTaskFanOut.class);

    private final StageTaskQueue queue;

    public ChildTaskFanOut(StageTaskQueue queue) {
        this.queue = queue;
    }

    public StageOutcome run(
        long searchId,
        String taskName,
        String queueName,
        List<Long> itemIds,
        Duration perItemTimeout,
        String verb
    ) {
        if (itemIds.isEmpty()) {
            return StageOutcome.success(0, 0, 0, "No documents to process");
        }
        List<String> handles = new ArrayList<>(itemIds.size());
        for (Long itemId : itemIds) {
            handles.add(queue.submit(taskName, searchId, itemId, null, queueName, Duration.ZERO));
        }

        int succeeded = 0;
        int failed = 0;
        String lastError = null;
        for (int i = 0; i < handles.size(); i++) {
            String handle = handles.get(i);
            try {
                StageOutcome outcome = queue.getResult(handle, perItemTimeout);
                if (outcome.isSuccess()) {
                    succeeded++;
                } else if (StageOutcome.SKIPPED.equals(outcome.status())) {
                    log.debug("Task {} for item {} of search {} skipped: {}", taskName, itemIds.get(i), searchId, outcome.message());
                } else {
                    failed++;
                    lastError = outcome.message();
                }
            } catch (RuntimeException e) {
                failed++;
                lastError = ErrorClassifier.describe(e);
                log.warn("Task {} for item {} of search {} failed: {}", taskName, itemIds.get(i), searchId, lastError);
                queue.revoke(handle);
            }
        }

        String message = verb + " " + succeeded + " of " + itemIds.size() + " documents";
        if (succeeded == 0 && failed > 0) {
            throw new StageFailedException(message + "; last error: " + lastError);
        }
        return StageOutcome.success(itemIds.size(), succeeded, failed, message);
    }
}
