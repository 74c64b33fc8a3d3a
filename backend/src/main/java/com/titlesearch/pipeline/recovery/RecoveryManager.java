package com.titlesearch.pipeline.recovery;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs how far a failed search got from its diagnostic log and decides whether an explicit
 * retry may resume it. Entries whose stage is not a pipeline step (orchestration, maintenance) take
 * no part in step reconstruction but still count towards the error summary. Warnings take part in
 * neither.
 */
@Component
public class RecoveryManager {
    private final ErrorClassifier classifier;
    private final PipelineProperties properties;

    public RecoveryManager(ErrorClassifier classifier, PipelineProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    public Optional<PipelineStep> lastSuccessfulStep(List<DiagnosticEntry> errorLog) {
        Optional<PipelineStep> earliestFailed = earliestFailedStep(errorLog);
        if (earliestFailed.isEmpty() || earliestFailed.get().ordinal() == 0) {
            return Optional.empty();
        }
        return Optional.of(PipelineStep.values()[earliestFailed.get().ordinal() - 1]);
    }

    public PipelineStep resumeStep(List<DiagnosticEntry> errorLog) {
        return lastSuccessfulStep(errorLog)
            .flatMap(PipelineStep::next)
            .orElse(PipelineStep.first());
    }

    public ResumeDecision canResume(SearchStatus status, List<DiagnosticEntry> errorLog, int retryCount) {
        if (status != SearchStatus.FAILED) {
            return new ResumeDecision(false, "Search is not in a failed state");
        }
        RecoverySuggestions suggestions = classifier.recoverySuggestions(
            errorLog,
            properties.getRecovery().getConsecutiveFailureThreshold()
        );
        if (!suggestions.canRetry()) {
            return new ResumeDecision(false, "Too many failures or non-recoverable error");
        }
        if (retryCount >= properties.getRecovery().getMaxResumeAttempts()) {
            return new ResumeDecision(false, "Maximum retry attempts exceeded");
        }
        return new ResumeDecision(true, "Can resume from step: " + resumeStep(errorLog).wireName());
    }

    public RecoveryOptions recoveryOptions(
        SearchStatus status,
        List<DiagnosticEntry> errorLog,
        int retryCount,
        int progressPercent
    ) {
        RecoverySuggestions suggestions = classifier.recoverySuggestions(
            errorLog,
            properties.getRecovery().getConsecutiveFailureThreshold()
        );
        ResumeDecision decision = canResume(status, errorLog, retryCount);

        List<ManualAction> actions = new ArrayList<>();
        if (decision.resumable()) {
            actions.add(new ManualAction(
                "retry",
                "Retry Search",
                "Resume the search from where it failed"
            ));
        }
        if (progressPercent >= properties.getRecovery().getPartialResultsMinProgress()) {
            actions.add(new ManualAction(
                "partial_complete",
                "Accept Partial Results",
                "Generate report with documents found so far"
            ));
        }
        actions.add(new ManualAction(
            "manual_upload",
            "Upload Documents Manually",
            "Upload documents obtained from the county directly"
        ));
        actions.add(new ManualAction(
            "cancel",
            "Cancel Search",
            "Cancel this search"
        ));

        return new RecoveryOptions(
            decision.resumable(),
            decision.reason(),
            decision.resumable() ? resumeStep(errorLog) : null,
            suggestions.suggestions(),
            suggestions.errorSummary(),
            suggestions.latestError(),
            progressPercent,
            List.copyOf(actions)
        );
    }

    private Optional<PipelineStep> earliestFailedStep(List<DiagnosticEntry> errorLog) {
        if (errorLog == null || errorLog.isEmpty()) {
            return Optional.empty();
        }
        PipelineStep earliest = null;
        for (DiagnosticEntry entry : errorLog) {
            if (ErrorClassifier.isWarning(entry)) {
                continue;
            }
            Optional<PipelineStep> step = PipelineStep.fromWireName(entry.stage());
            if (step.isPresent() && (earliest == null || step.get().ordinal() < earliest.ordinal())) {
                earliest = step.get();
            }
        }
        return Optional.ofNullable(earliest);
    }
}
