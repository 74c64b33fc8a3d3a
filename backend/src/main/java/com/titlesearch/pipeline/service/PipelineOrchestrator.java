package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.RetryResult;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatus;
import com.titlesearch.pipeline.model.SearchStatusView;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.StageTaskQueue;
import com.titlesearch.pipeline.queue.TaskNames;
import com.titlesearch.pipeline.recovery.ErrorDiagnosis;
import com.titlesearch.pipeline.recovery.RecoveryManager;
import com.titlesearch.pipeline.recovery.RecoveryOptions;
import com.titlesearch.pipeline.recovery.ResumeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a search through the fixed step chain. Every step is its own queue task and submits the
 * next one when it completes, so steps of one search run strictly in order while different
 * searches progress independently.
 *
 * <p>Status and progress writes are guarded in SQL against terminal rows. A step that completes
 * after its search was cancelled therefore changes nothing and does not advance the chain.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    static final String ORCHESTRATION_STAGE = "orchestrate";

    private final SearchJobRepository searchJobs;
    private final StageTaskQueue queue;
    private final DiagnosticsService diagnostics;
    private final RecoveryManager recoveryManager;
    private final PipelineProperties properties;
    private final Map<PipelineStep, PipelineStage> stages = new EnumMap<>(PipelineStep.class);

    public PipelineOrchestrator(
        SearchJobRepository searchJobs,
        StageTaskQueue queue,
        DiagnosticsService diagnostics,
        RecoveryManager recoveryManager,
        PipelineProperties properties,
        List<PipelineStage> stageList
    ) {
        this.searchJobs = searchJobs;
        this.queue = queue;
        this.diagnostics = diagnostics;
        this.recoveryManager = recoveryManager;
        this.properties = properties;
        for (PipelineStage stage : stageList) {
            stages.put(stage.step(), stage);
        }
        for (PipelineStep step : PipelineStep.values()) {
            if (!stages.containsKey(step)) {
                throw new IllegalStateException("No stage registered for step " + step.wireName());
            }
        }
    }

    /** Queues the orchestration task that starts a pending search at {@code startStep}. */
    public String submit(long searchId, PipelineStep startStep) {
        return submit(searchId, startStep, Duration.ZERO);
    }

    public String submit(long searchId, PipelineStep startStep, Duration delay) {
        SearchJob job = requireJob(searchId);
        String handle = queue.submit(
            TaskNames.ORCHESTRATE_SEARCH,
            searchId,
            null,
            startStep.wireName(),
            queueFor(job.priority()),
            delay
        );
        searchJobs.updateExternalHandle(searchId, handle);
        log.info("Search {} submitted, starting at step {}", searchId, startStep.wireName());
        return handle;
    }

    public StageOutcome orchestrate(long searchId, PipelineStep startStep) {
        SearchJob job = searchJobs.findById(searchId);
        if (job == null) {
            throw new IllegalStateException("Invalid search: " + searchId + " not found");
        }
        if (!searchJobs.markQueued(searchId, "Search queued: " + startStep.label())) {
            log.info("Search {} is {}, not starting", searchId, job.status());
            return StageOutcome.skipped("Search " + searchId + " is not pending");
        }
        submitStep(job, startStep);
        return StageOutcome.success("Started at step " + startStep.wireName());
    }

    public StageOutcome executeStep(long searchId, PipelineStep step) throws Exception {
        SearchJob job = searchJobs.findById(searchId);
        if (job == null || job.status().isTerminal()) {
            log.info("Ignoring step {} for search {} in status {}",
                step.wireName(), searchId, job == null ? "missing" : job.status());
            return StageOutcome.skipped("Search " + searchId + " is not active");
        }
        if (!searchJobs.updateProgress(searchId, step.entryStatus(), step.entryProgress(), step.label() + "...")) {
            return StageOutcome.skipped("Search " + searchId + " is not active");
        }

        StageOutcome outcome = stages.get(step).execute(job);

        Optional<PipelineStep> next = step.next();
        if (next.isEmpty()) {
            return outcome;
        }
        String message = outcome.message() == null ? step.label() + " complete" : outcome.message();
        if (!searchJobs.updateProgress(searchId, null, step.exitProgress(), message)) {
            log.info("Search {} finished while step {} was running, chain stops here", searchId, step.wireName());
            return outcome;
        }
        submitStep(job, next.get());
        return outcome;
    }

    /**
     * Error boundary of a step: the failure is always logged to the search; the search fails only
     * once the queue has no retry left for the step.
     */
    public void onStepFailure(long searchId, PipelineStep step, String error, int attempts, boolean willRetry) {
        recordFailure(searchId, step.wireName(), error, attempts, willRetry);
    }

    public void onOrchestrationFailure(long searchId, String error, int attempts, boolean willRetry) {
        recordFailure(searchId, ORCHESTRATION_STAGE, error, attempts, willRetry);
    }

    public SearchStatusView cancel(long searchId) {
        SearchJob job = requireJob(searchId);
        if (job.status() == SearchStatus.COMPLETED || job.status() == SearchStatus.CANCELLED) {
            throw new InvalidSearchStateException("Cannot cancel a search that is " + job.status());
        }
        if (!searchJobs.markCancelled(searchId)) {
            throw new InvalidSearchStateException("Search " + searchId + " finished before it could be cancelled");
        }
        if (job.externalTaskHandle() != null) {
            try {
                queue.revoke(job.externalTaskHandle());
            } catch (RuntimeException e) {
                log.warn("Failed to revoke task {} of cancelled search {}", job.externalTaskHandle(), searchId, e);
            }
        }
        log.info("Search {} cancelled", searchId);
        return SearchStatusView.from(requireJob(searchId));
    }

    /** Explicit resumption of a failed search from the step after the last one that succeeded. */
    public RetryResult retry(long searchId) {
        SearchJob job = requireJob(searchId);
        ResumeDecision decision = recoveryManager.canResume(job.status(), job.errorLog(), job.retryCount());
        if (!decision.resumable()) {
            throw new InvalidSearchStateException(decision.reason());
        }
        PipelineStep resumeStep = recoveryManager.resumeStep(job.errorLog());
        if (!searchJobs.resetForRetry(searchId, "Retrying from step: " + resumeStep.wireName())) {
            throw new InvalidSearchStateException("Search " + searchId + " is no longer failed");
        }
        String handle = submit(searchId, resumeStep);
        return new RetryResult(searchId, resumeStep, decision.reason(), handle);
    }

    public SearchStatusView acceptPartialResults(long searchId) {
        SearchJob job = requireJob(searchId);
        int minProgress = properties.getRecovery().getPartialResultsMinProgress();
        if (job.status() != SearchStatus.FAILED) {
            throw new InvalidSearchStateException("Only failed searches can accept partial results");
        }
        if (job.progressPercent() < minProgress) {
            throw new InvalidSearchStateException(
                "Partial results need at least " + minProgress + "% progress, search reached " + job.progressPercent() + "%"
            );
        }
        if (!searchJobs.acceptPartialResults(searchId, "Completed with partial results")) {
            throw new InvalidSearchStateException("Search " + searchId + " is no longer failed");
        }
        return SearchStatusView.from(requireJob(searchId));
    }

    public RecoveryOptions recoveryOptions(long searchId) {
        SearchJob job = requireJob(searchId);
        return recoveryManager.recoveryOptions(job.status(), job.errorLog(), job.retryCount(), job.progressPercent());
    }

    private void recordFailure(long searchId, String stage, String error, int attempts, boolean willRetry) {
        ErrorDiagnosis diagnosis = diagnostics.record(searchId, stage, error, attempts);
        if (willRetry) {
            return;
        }
        if (searchJobs.markFailed(searchId, diagnosis.userMessage())) {
            log.warn("Search {} failed at {}: {}", searchId, stage, error);
        }
    }

    private void submitStep(SearchJob job, PipelineStep step) {
        String handle = queue.submit(
            TaskNames.PIPELINE_STEP,
            job.id(),
            null,
            step.wireName(),
            queueFor(job.priority()),
            Duration.ZERO
        );
        searchJobs.updateExternalHandle(job.id(), handle);
    }

    private SearchJob requireJob(long searchId) {
        SearchJob job = searchJobs.findById(searchId);
        if (job == null) {
            throw new SearchNotFoundException(searchId);
        }
        return job;
    }

    static String queueFor(SearchPriority priority) {
        return priority != null && priority.isExpedited() ? QueueNames.HIGH_PRIORITY : QueueNames.DEFAULT;
    }
}
