package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;

/**
 * Work of one pipeline step. Status and progress at the step boundaries belong to
 * {@link PipelineOrchestrator}; a stage only does its own work and throws when it cannot.
 */
public interface PipelineStage {
    PipelineStep step();

    StageOutcome execute(SearchJob job) throws Exception;
}
