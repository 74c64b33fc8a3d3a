package com.titlesearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Fixed step order shared by every search job. Ordinal order is the execution order.
 */
public enum PipelineStep {
    SCRAPE("scrape", SearchStatus.SCRAPING, 10, 30, "Scraping county records"),
    COURT_SEARCH("court-search", null, 35, 40, "Searching court records"),
    DOWNLOAD("download", null, 45, 55, "Downloading documents"),
    ANALYZE("analyze", SearchStatus.ANALYZING, 60, 70, "Analyzing documents"),
    BUILD_CHAIN("build-chain", null, 75, 80, "Building chain of title"),
    REPORT("report", SearchStatus.GENERATING, 85, 95, "Generating title report"),
    FINALIZE("finalize", null, 100, 100, "Finalizing search");

    private final String wireName;
    private final SearchStatus entryStatus;
    private final int entryProgress;
    private final int exitProgress;
    private final String label;

    PipelineStep(String wireName, SearchStatus entryStatus, int entryProgress, int exitProgress, String label) {
        this.wireName = wireName;
        this.entryStatus = entryStatus;
        this.entryProgress = entryProgress;
        this.exitProgress = exitProgress;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Status the job moves to when this step starts, or null when the step keeps the current status.
     */
    public SearchStatus entryStatus() {
        return entryStatus;
    }

    public int entryProgress() {
        return entryProgress;
    }

    public int exitProgress() {
        return exitProgress;
    }

    public String label() {
        return label;
    }

    public Optional<PipelineStep> next() {
        PipelineStep[] steps = values();
        int nextIndex = ordinal() + 1;
        return nextIndex < steps.length ? Optional.of(steps[nextIndex]) : Optional.empty();
    }

    public static PipelineStep first() {
        return values()[0];
    }

    public static Optional<PipelineStep> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (PipelineStep step : values()) {
            if (step.wireName.equals(normalized)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }
}
