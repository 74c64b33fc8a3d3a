package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.StageTaskQueue;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ScrapeRecordsStage implements PipelineStage {
    private final StageTaskQueue queue;
    private final SearchJobRepository searchJobs;
    private final PipelineProperties properties;

    public ScrapeRecordsStage(StageTaskQueue queue, SearchJobRepository searchJobs, PipelineProperties properties) {
        this.queue = queue;
        this.searchJobs = searchJobs;
        this.properties = properties;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.SCRAPE;
    }

    @Override
    public StageOutcome execute(SearchJob job) {
        String handle = queue.submit(
            TaskNames.SCRAPE_COUNTY_RECORDS,
            job.id(),
            null,
            null,
            QueueNames.SCRAPING,
            Duration.ZERO
        );
        searchJobs.updateExternalHandle(job.id(), handle);
        return queue.getResult(handle, Duration.ofSeconds(properties.getStages().getScrapeTimeoutSeconds()));
    }
}
