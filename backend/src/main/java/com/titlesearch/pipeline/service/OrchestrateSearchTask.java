package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

/**
 * Top-level task of a run: moves the search to QUEUED and dispatches its first step, which is the
 * resume step on a retry.
 */
@Component
public class OrchestrateSearchTask implements StageTaskHandler {
    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    public OrchestrateSearchTask(PipelineOrchestrator orchestrator, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.ORCHESTRATE_SEARCH;
    }

    @Override
    public int maxRetries() {
        return properties.getStages().getStepMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) {
        PipelineStep startStep = PipelineStep.fromWireName(task.payload()).orElse(PipelineStep.first());
        return orchestrator.orchestrate(task.searchId(), startStep);
    }

    @Override
    public void onFailure(StageTask task, String error, boolean willRetry) {
        orchestrator.onOrchestrationFailure(task.searchId(), error, task.attempts(), willRetry);
    }
}
