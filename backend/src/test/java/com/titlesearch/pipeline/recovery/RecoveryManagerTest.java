package com.titlesearch.pipeline.recovery;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryManagerTest {
    private final RecoveryManager manager = new RecoveryManager(new ErrorClassifier(), new PipelineProperties());

    @Test
    void transientScrapeFailureResumesAtScrape() {
        List<DiagnosticEntry> log = List.of(entry("scrape", ErrorCategory.NETWORK, Severity.MEDIUM));

        ResumeDecision decision = manager.canResume(SearchStatus.FAILED, log, 0);

        assertThat(decision.resumable()).isTrue();
        assertThat(manager.lastSuccessfulStep(log)).isEmpty();
        assertThat(manager.resumeStep(log)).isEqualTo(PipelineStep.SCRAPE);
    }

    @Test
    void structuralScrapeFailureCannotResume() {
        List<DiagnosticEntry> log = List.of(entry("scrape", ErrorCategory.SCRAPING, Severity.HIGH));

        assertThat(manager.canResume(SearchStatus.FAILED, log, 0).resumable()).isFalse();
    }

    @Test
    void threeTrailingCriticalEntriesBlockResumeRegardlessOfCategory() {
        List<DiagnosticEntry> log = List.of(
            entry("analyze", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("analyze", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("analyze", ErrorCategory.DATABASE, Severity.CRITICAL)
        );

        assertThat(manager.canResume(SearchStatus.FAILED, log, 0).resumable()).isFalse();
    }

    @Test
    void onlyFailedSearchesCanResume() {
        List<DiagnosticEntry> log = List.of(entry("download", ErrorCategory.NETWORK, Severity.MEDIUM));

        assertThat(manager.canResume(SearchStatus.SCRAPING, log, 0).resumable()).isFalse();
        assertThat(manager.canResume(SearchStatus.CANCELLED, log, 0).resumable()).isFalse();
    }

    @Test
    void resumeAttemptCeilingIsEnforced() {
        List<DiagnosticEntry> log = List.of(entry("download", ErrorCategory.NETWORK, Severity.MEDIUM));

        ResumeDecision decision = manager.canResume(SearchStatus.FAILED, log, 5);

        assertThat(decision.resumable()).isFalse();
        assertThat(decision.reason()).isEqualTo("Maximum retry attempts exceeded");
    }

    @Test
    void resumeStepFollowsTheStepBeforeTheEarliestFailure() {
        List<DiagnosticEntry> log = List.of(
            entry("analyze", ErrorCategory.EXTERNAL_SERVICE, Severity.MEDIUM),
            entry("download", ErrorCategory.NETWORK, Severity.MEDIUM),
            entry("report", ErrorCategory.TIMEOUT, Severity.MEDIUM)
        );

        assertThat(manager.lastSuccessfulStep(log)).contains(PipelineStep.COURT_SEARCH);
        assertThat(manager.resumeStep(log)).isEqualTo(PipelineStep.DOWNLOAD);
        assertThat(manager.resumeStep(log)).isEqualTo(manager.resumeStep(log));
        assertThat(manager.resumeStep(log).ordinal())
            .isGreaterThan(manager.lastSuccessfulStep(log).get().ordinal());
    }

    @Test
    void nonStepStagesAreIgnoredForResumption() {
        List<DiagnosticEntry> log = List.of(
            entry("orchestrate", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("build-chain", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("cleanup", ErrorCategory.TIMEOUT, Severity.MEDIUM)
        );

        assertThat(manager.resumeStep(log)).isEqualTo(PipelineStep.BUILD_CHAIN);
    }

    @Test
    void emptyLogResumesAtFirstStep() {
        assertThat(manager.resumeStep(List.of())).isEqualTo(PipelineStep.first());
        assertThat(manager.resumeStep(null)).isEqualTo(PipelineStep.first());
    }

    @Test
    void recoveryOptionsOfferPartialResultsOnlyPastThreshold() {
        List<DiagnosticEntry> log = List.of(entry("analyze", ErrorCategory.EXTERNAL_SERVICE, Severity.MEDIUM));

        RecoveryOptions early = manager.recoveryOptions(SearchStatus.FAILED, log, 0, 20);
        RecoveryOptions late = manager.recoveryOptions(SearchStatus.FAILED, log, 0, 60);

        assertThat(early.actions()).extracting(ManualAction::action)
            .containsExactly("retry", "manual_upload", "cancel");
        assertThat(late.actions()).extracting(ManualAction::action)
            .containsExactly("retry", "partial_complete", "manual_upload", "cancel");
        assertThat(late.resumeStep()).isEqualTo(PipelineStep.ANALYZE);
        assertThat(late.latestError().stage()).isEqualTo("analyze");
    }

    @Test
    void courtRecordsOutageDoesNotPinResumptionToCourtSearch() {
        DiagnosticEntry courtOutage = new ErrorClassifier().createWarningEntry(
            "RecorderUnavailableException: Court records website unavailable for Denver County", "court-search");
        List<DiagnosticEntry> log = List.of(
            courtOutage,
            entry("analyze", ErrorCategory.EXTERNAL_SERVICE, Severity.MEDIUM)
        );

        assertThat(courtOutage.category()).isEqualTo(ErrorCategory.SCRAPING);
        assertThat(courtOutage.severity()).isEqualTo(Severity.WARNING);
        assertThat(manager.canResume(SearchStatus.FAILED, log, 0).resumable()).isTrue();
        assertThat(manager.resumeStep(log)).isEqualTo(PipelineStep.ANALYZE);
        assertThat(manager.lastSuccessfulStep(log)).contains(PipelineStep.COURT_SEARCH);
    }

    @Test
    void warningsDoNotBreakOrExtendTheHighSeverityStreak() {
        List<DiagnosticEntry> log = List.of(
            entry("download", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("court-search", ErrorCategory.SCRAPING, Severity.WARNING),
            entry("download", ErrorCategory.DATABASE, Severity.CRITICAL),
            entry("court-search", ErrorCategory.SCRAPING, Severity.WARNING),
            entry("court-search", ErrorCategory.SCRAPING, Severity.WARNING)
        );

        RecoverySuggestions suggestions = new ErrorClassifier().recoverySuggestions(log, 3);

        assertThat(suggestions.errorSummary().totalErrors()).isEqualTo(2);
        assertThat(suggestions.errorSummary().byCategory()).containsOnlyKeys(ErrorCategory.DATABASE);
        assertThat(suggestions.errorSummary().consecutiveFailures()).isEqualTo(2);
        assertThat(suggestions.latestError().stage()).isEqualTo("download");
    }

    @Test
    void logOfOnlyWarningsIsTreatedAsClean() {
        List<DiagnosticEntry> log = List.of(entry("court-search", ErrorCategory.SCRAPING, Severity.WARNING));

        assertThat(manager.canResume(SearchStatus.FAILED, log, 0).resumable()).isTrue();
        assertThat(manager.resumeStep(log)).isEqualTo(PipelineStep.first());
    }

    private static DiagnosticEntry entry(String stage, ErrorCategory category, Severity severity) {
        return new DiagnosticEntry(
            Instant.now(),
            stage,
            category.wireName() + " failure",
            category,
            severity,
            category.isTransient(),
            category.actions().get(0)
        );
    }
}
