package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

/**
 * Turns the rows of a batch into searches. A retried run picks up at the first row still pending.
 */
@Component
public class ProcessBatchTask implements StageTaskHandler {
    private final BatchIntakeService batchIntake;
    private final PipelineProperties properties;

    public ProcessBatchTask(BatchIntakeService batchIntake, PipelineProperties properties) {
        this.batchIntake = batchIntake;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.PROCESS_BATCH;
    }

    @Override
    public int maxRetries() {
        return properties.getStages().getStepMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) {
        if (task.itemId() == null) {
            throw new IllegalArgumentException("Invalid batch task: no batch id");
        }
        return batchIntake.process(task.itemId());
    }

    @Override
    public void onFailure(StageTask task, String error, boolean willRetry) {
        if (!willRetry && task.itemId() != null) {
            batchIntake.markFailed(task.itemId(), error);
        }
    }
}
