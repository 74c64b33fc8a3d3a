package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Queue task running one pipeline step; the payload names the step.
 */
@Component
public class PipelineStepTask implements StageTaskHandler {
    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    public PipelineStepTask(PipelineOrchestrator orchestrator, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.PIPELINE_STEP;
    }

    @Override
    public int maxRetries() {
        return properties.getStages().getStepMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) throws Exception {
        return orchestrator.executeStep(task.searchId(), stepOf(task));
    }

    @Override
    public void onFailure(StageTask task, String error, boolean willRetry) {
        Optional<PipelineStep> step = PipelineStep.fromWireName(task.payload());
        if (step.isPresent()) {
            orchestrator.onStepFailure(task.searchId(), step.get(), error, task.attempts(), willRetry);
        } else {
            orchestrator.onOrchestrationFailure(task.searchId(), error, task.attempts(), willRetry);
        }
    }

    private static PipelineStep stepOf(StageTask task) {
        return PipelineStep.fromWireName(task.payload())
            .orElseThrow(() -> new IllegalArgumentException("Invalid pipeline step: " + task.payload()));
    }
}
