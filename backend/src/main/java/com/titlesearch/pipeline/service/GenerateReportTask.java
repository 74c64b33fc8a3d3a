package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.model.TitleReportSummary;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

@Component
public class GenerateReportTask implements StageTaskHandler {
    private final SearchJobRepository searchJobs;
    private final TitleReportService reportService;
    private final PipelineProperties properties;

    public GenerateReportTask(
        SearchJobRepository searchJobs,
        TitleReportService reportService,
        PipelineProperties properties
    ) {
        this.searchJobs = searchJobs;
        this.reportService = reportService;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.GENERATE_REPORT;
    }

    @Override
    public int maxRetries() {
        return properties.getRetry().getReportMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) {
        SearchJob job = searchJobs.findById(task.searchId());
        if (job == null || job.status().isTerminal()) {
            return StageOutcome.skipped("Search " + task.searchId() + " is no longer active");
        }
        TitleReportSummary report = reportService.generate(job.id());
        return StageOutcome.success(
            1,
            1,
            0,
            "Report " + report.reportNumber() + ": " + report.riskLevel() + " risk (" + report.riskScore() + "/100)"
        );
    }
}
