package com.titlesearch.pipeline.queue;

import java.util.List;

public final class QueueNames {
    public static final String HIGH_PRIORITY = "high_priority";
    public static final String DEFAULT = "default";
    public static final String SCRAPING = "scraping";
    public static final String AI_ANALYSIS = "ai_analysis";
    public static final String REPORT_GENERATION = "report_generation";

    public static final List<String> ALL = List.of(HIGH_PRIORITY, DEFAULT, SCRAPING, AI_ANALYSIS, REPORT_GENERATION);

    private QueueNames() {
    }
}
