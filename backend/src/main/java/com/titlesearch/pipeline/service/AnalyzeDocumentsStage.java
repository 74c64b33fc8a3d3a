package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
public class AnalyzeDocumentsStage implements PipelineStage {
    private final DocumentRepository documents;
    private final ChildTaskFanOut fanOut;
    private final PipelineProperties properties;

    public AnalyzeDocumentsStage(DocumentRepository documents, ChildTaskFanOut fanOut, PipelineProperties properties) {
        this.documents = documents;
        this.fanOut = fanOut;
        this.properties = properties;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.ANALYZE;
    }

    @Override
    public StageOutcome execute(SearchJob job) {
        List<Long> pending = documents.findPendingAnalysis(job.id()).stream()
            .map(DocumentRecord::id)
            .toList();
        return fanOut.run(
            job.id(),
            TaskNames.ANALYZE_DOCUMENT,
            QueueNames.AI_ANALYSIS,
            pending,
            Duration.ofSeconds(properties.getStages().getAnalyzeTimeoutSeconds()),
            "Analyzed"
        );
    }
}
