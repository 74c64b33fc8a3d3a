package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import org.springframework.stereotype.Component;

@Component
public class FinalizeStage implements PipelineStage {
    static final String NO_DOCUMENTS_MESSAGE = "Search completed: no recorded documents found";

    private final SearchJobRepository searchJobs;
    private final DocumentRepository documents;

    public FinalizeStage(SearchJobRepository searchJobs, DocumentRepository documents) {
        this.searchJobs = searchJobs;
        this.documents = documents;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.FINALIZE;
    }

    @Override
    public StageOutcome execute(SearchJob job) {
        int documentCount = documents.countBySearch(job.id());
        String message = documentCount == 0
            ? NO_DOCUMENTS_MESSAGE
            : "Search completed: " + documentCount + " documents found";
        if (!searchJobs.markCompleted(job.id(), message)) {
            return StageOutcome.skipped("Search " + job.id() + " already finished");
        }
        return StageOutcome.success(documentCount, documentCount, 0, message);
    }
}
