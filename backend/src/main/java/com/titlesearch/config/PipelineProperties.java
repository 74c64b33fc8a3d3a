package com.titlesearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private String storagePath = "./storage";
    private int searchYears = 40;
    private Browser browser = new Browser();
    private Queue queue = new Queue();
    private Stages stages = new Stages();
    private Retry retry = new Retry();
    private Recovery recovery = new Recovery();
    private Maintenance maintenance = new Maintenance();
    private Analysis analysis = new Analysis();
    private Seed seed = new Seed();
    private Batch batch = new Batch();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public int getSearchYears() {
        return Math.max(1, searchYears);
    }

    public void setSearchYears(int searchYears) {
        this.searchYears = Math.max(1, searchYears);
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Stages getStages() {
        return stages;
    }

    public void setStages(Stages stages) {
        this.stages = stages;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Seed getSeed() {
        return seed;
    }

    public void setSeed(Seed seed) {
        this.seed = seed;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    private static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Browser {
        private int poolSize = 5;
        private boolean headless = true;
        private int timeoutMs = 30000;
        private int maxRequestsPerInstance = 100;
        private int acquirePollIntervalMs = 1000;
        private int acquireMaxPolls = 10;
        private boolean eagerStart = false;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getTimeoutMs() {
            return Math.max(1000, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(1000, timeoutMs);
        }

        public int getMaxRequestsPerInstance() {
            return Math.max(1, maxRequestsPerInstance);
        }

        public void setMaxRequestsPerInstance(int maxRequestsPerInstance) {
            this.maxRequestsPerInstance = Math.max(1, maxRequestsPerInstance);
        }

        public int getAcquirePollIntervalMs() {
            return Math.max(1, acquirePollIntervalMs);
        }

        public void setAcquirePollIntervalMs(int acquirePollIntervalMs) {
            this.acquirePollIntervalMs = Math.max(1, acquirePollIntervalMs);
        }

        public int getAcquireMaxPolls() {
            return Math.max(0, acquireMaxPolls);
        }

        public void setAcquireMaxPolls(int acquireMaxPolls) {
            this.acquireMaxPolls = Math.max(0, acquireMaxPolls);
        }

        public boolean isEagerStart() {
            return eagerStart;
        }

        public void setEagerStart(boolean eagerStart) {
            this.eagerStart = eagerStart;
        }

        public int getViewportWidth() {
            return viewportWidth;
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return viewportHeight;
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }
    }

    public static class Queue {
        private boolean enabled = true;
        private Map<String, Integer> workers = defaultWorkers();
        private int pollIntervalMs = 500;
        private int resultPollIntervalMs = 250;
        private long lockTtlSeconds = 900;
        private int maxRetryDelaySeconds = 600;

        private static Map<String, Integer> defaultWorkers() {
            Map<String, Integer> workers = new LinkedHashMap<>();
            workers.put("high_priority", 1);
            workers.put("default", 2);
            workers.put("scraping", 2);
            workers.put("ai_analysis", 2);
            workers.put("report_generation", 1);
            return workers;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Integer> getWorkers() {
            return workers;
        }

        public void setWorkers(Map<String, Integer> workers) {
            this.workers = workers == null ? defaultWorkers() : workers;
        }

        public int getPollIntervalMs() {
            return Math.max(1, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(1, pollIntervalMs);
        }

        public int getResultPollIntervalMs() {
            return Math.max(1, resultPollIntervalMs);
        }

        public void setResultPollIntervalMs(int resultPollIntervalMs) {
            this.resultPollIntervalMs = Math.max(1, resultPollIntervalMs);
        }

        public long getLockTtlSeconds() {
            return Math.max(1, lockTtlSeconds);
        }

        public void setLockTtlSeconds(long lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(1, lockTtlSeconds);
        }

        public int getMaxRetryDelaySeconds() {
            return Math.max(1, maxRetryDelaySeconds);
        }

        public void setMaxRetryDelaySeconds(int maxRetryDelaySeconds) {
            this.maxRetryDelaySeconds = Math.max(1, maxRetryDelaySeconds);
        }
    }

    public static class Stages {
        private int scrapeTimeoutSeconds = 300;
        private int downloadTimeoutSeconds = 60;
        private int analyzeTimeoutSeconds = 120;
        private int reportTimeoutSeconds = 180;
        private int stepMaxRetries = 0;

        public int getScrapeTimeoutSeconds() {
            return Math.max(1, scrapeTimeoutSeconds);
        }

        public void setScrapeTimeoutSeconds(int scrapeTimeoutSeconds) {
            this.scrapeTimeoutSeconds = Math.max(1, scrapeTimeoutSeconds);
        }

        public int getDownloadTimeoutSeconds() {
            return Math.max(1, downloadTimeoutSeconds);
        }

        public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) {
            this.downloadTimeoutSeconds = Math.max(1, downloadTimeoutSeconds);
        }

        public int getAnalyzeTimeoutSeconds() {
            return Math.max(1, analyzeTimeoutSeconds);
        }

        public void setAnalyzeTimeoutSeconds(int analyzeTimeoutSeconds) {
            this.analyzeTimeoutSeconds = Math.max(1, analyzeTimeoutSeconds);
        }

        public int getReportTimeoutSeconds() {
            return Math.max(1, reportTimeoutSeconds);
        }

        public void setReportTimeoutSeconds(int reportTimeoutSeconds) {
            this.reportTimeoutSeconds = Math.max(1, reportTimeoutSeconds);
        }

        public int getStepMaxRetries() {
            return Math.max(0, stepMaxRetries);
        }

        public void setStepMaxRetries(int stepMaxRetries) {
            this.stepMaxRetries = Math.max(0, stepMaxRetries);
        }
    }

    public static class Retry {
        private int scrapeMaxRetries = 3;
        private int downloadMaxRetries = 2;
        private int analyzeMaxRetries = 2;
        private int reportMaxRetries = 2;

        public int getScrapeMaxRetries() {
            return Math.max(0, scrapeMaxRetries);
        }

        public void setScrapeMaxRetries(int scrapeMaxRetries) {
            this.scrapeMaxRetries = Math.max(0, scrapeMaxRetries);
        }

        public int getDownloadMaxRetries() {
            return Math.max(0, downloadMaxRetries);
        }

        public void setDownloadMaxRetries(int downloadMaxRetries) {
            this.downloadMaxRetries = Math.max(0, downloadMaxRetries);
        }

        public int getAnalyzeMaxRetries() {
            return Math.max(0, analyzeMaxRetries);
        }

        public void setAnalyzeMaxRetries(int analyzeMaxRetries) {
            this.analyzeMaxRetries = Math.max(0, analyzeMaxRetries);
        }

        public int getReportMaxRetries() {
            return Math.max(0, reportMaxRetries);
        }

        public void setReportMaxRetries(int reportMaxRetries) {
            this.reportMaxRetries = Math.max(0, reportMaxRetries);
        }
    }

    public static class Recovery {
        private int maxResumeAttempts = 5;
        private int consecutiveFailureThreshold = 3;
        private int partialResultsMinProgress = 30;

        public int getMaxResumeAttempts() {
            return Math.max(1, maxResumeAttempts);
        }

        public void setMaxResumeAttempts(int maxResumeAttempts) {
            this.maxResumeAttempts = Math.max(1, maxResumeAttempts);
        }

        public int getConsecutiveFailureThreshold() {
            return Math.max(1, consecutiveFailureThreshold);
        }

        public void setConsecutiveFailureThreshold(int consecutiveFailureThreshold) {
            this.consecutiveFailureThreshold = Math.max(1, consecutiveFailureThreshold);
        }

        public int getPartialResultsMinProgress() {
            return Math.min(100, Math.max(0, partialResultsMinProgress));
        }

        public void setPartialResultsMinProgress(int partialResultsMinProgress) {
            this.partialResultsMinProgress = Math.min(100, Math.max(0, partialResultsMinProgress));
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private int staleSearchHours = 2;
        private int staleSweepIntervalMinutes = 15;
        private int healthCheckIntervalMinutes = 60;
        private int unhealthyFailureThreshold = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getStaleSearchHours() {
            return Math.max(1, staleSearchHours);
        }

        public void setStaleSearchHours(int staleSearchHours) {
            this.staleSearchHours = Math.max(1, staleSearchHours);
        }

        public int getStaleSweepIntervalMinutes() {
            return Math.max(1, staleSweepIntervalMinutes);
        }

        public void setStaleSweepIntervalMinutes(int staleSweepIntervalMinutes) {
            this.staleSweepIntervalMinutes = Math.max(1, staleSweepIntervalMinutes);
        }

        public int getHealthCheckIntervalMinutes() {
            return Math.max(1, healthCheckIntervalMinutes);
        }

        public void setHealthCheckIntervalMinutes(int healthCheckIntervalMinutes) {
            this.healthCheckIntervalMinutes = Math.max(1, healthCheckIntervalMinutes);
        }

        public int getUnhealthyFailureThreshold() {
            return Math.max(1, unhealthyFailureThreshold);
        }

        public void setUnhealthyFailureThreshold(int unhealthyFailureThreshold) {
            this.unhealthyFailureThreshold = Math.max(1, unhealthyFailureThreshold);
        }
    }

    public static class Analysis {
        private String endpoint = "";
        private String apiKey = "";
        private int timeoutSeconds = 60;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint == null ? "" : endpoint.trim();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public boolean isEnabled() {
            return !endpoint.isBlank();
        }
    }

    public static class Seed {
        private boolean enabled = true;
        private String countiesCsv = "classpath:seed/counties.csv";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCountiesCsv() {
            return countiesCsv;
        }

        public void setCountiesCsv(String countiesCsv) {
            this.countiesCsv = countiesCsv;
        }
    }

    public static class Batch {
        private int maxRows = 5000;
        private int staggerSeconds = 1;
        private int listLimit = 20;

        public int getMaxRows() {
            return Math.max(1, maxRows);
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = Math.max(1, maxRows);
        }

        /** Spacing between the start times of consecutive searches a batch creates. */
        public int getStaggerSeconds() {
            return Math.max(0, staggerSeconds);
        }

        public void setStaggerSeconds(int staggerSeconds) {
            this.staggerSeconds = Math.max(0, staggerSeconds);
        }

        public int getListLimit() {
            return Math.max(1, listLimit);
        }

        public void setListLimit(int listLimit) {
            this.listLimit = Math.max(1, listLimit);
        }
    }
}
