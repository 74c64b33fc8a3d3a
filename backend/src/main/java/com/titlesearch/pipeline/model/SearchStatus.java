package com.titlesearch.pipeline.model;

import java.util.EnumSet;
import java.util.Set;

public enum SearchStatus {
    PENDING,
    QUEUED,
    SCRAPING,
    ANALYZING,
    GENERATING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<SearchStatus> IN_FLIGHT = EnumSet.of(QUEUED, SCRAPING, ANALYZING, GENERATING);
    public static final Set<SearchStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
