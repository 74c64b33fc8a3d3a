package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import com.titlesearch.pipeline.recovery.ErrorDiagnosis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies a failure and appends it to the search's error log.
 */
@Service
public class DiagnosticsService {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);

    private final ErrorClassifier classifier;
    private final SearchJobRepository searchJobs;

    public DiagnosticsService(ErrorClassifier classifier, SearchJobRepository searchJobs) {
        this.classifier = classifier;
        this.searchJobs = searchJobs;
    }

    public ErrorDiagnosis record(long searchId, String stage, String error, int retryCount) {
        ErrorDiagnosis diagnosis = classifier.diagnose(error, stage, retryCount);
        DiagnosticEntry entry = classifier.createEntry(error, stage, diagnosis);
        searchJobs.appendDiagnostic(searchId, entry);
        log.info(
            "Search {} stage {} failed: category={} severity={} action={}",
            searchId,
            stage,
            diagnosis.category().wireName(),
            diagnosis.severity().wireName(),
            diagnosis.recommendedAction().wireName()
        );
        return diagnosis;
    }

    /**
     * Appends a warning for a failure the stage recovered from. Warnings are shown with the search but
     * never decide where a retry resumes.
     */
    public DiagnosticEntry recordWarning(long searchId, String stage, String error) {
        DiagnosticEntry entry = classifier.createWarningEntry(error, stage);
        searchJobs.appendDiagnostic(searchId, entry);
        log.info("Search {} stage {} continued past: category={}", searchId, stage, entry.category().wireName());
        return entry;
    }
}
