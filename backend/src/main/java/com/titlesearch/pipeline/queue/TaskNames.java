package com.titlesearch.pipeline.queue;

public final class TaskNames {
    public static final String ORCHESTRATE_SEARCH = "orchestrate_search";
    public static final String PIPELINE_STEP = "pipeline_step";
    public static final String SCRAPE_COUNTY_RECORDS = "scrape_county_records";
    public static final String DOWNLOAD_DOCUMENT = "download_document";
    public static final String ANALYZE_DOCUMENT = "analyze_document";
    public static final String GENERATE_REPORT = "generate_report";
    /** Belongs to no search: carries the batch id as its item id. */
    public static final String PROCESS_BATCH = "process_batch";

    private TaskNames() {
    }
}
