package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.adapter.RecorderUnavailableException;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.recovery.ErrorDiagnosis;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic housekeeping: fails searches stuck in flight and re-evaluates county health.
 */
@Service
public class PipelineMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(PipelineMaintenanceService.class);
    static final String CLEANUP_STAGE = "cleanup";

    private final SearchJobRepository searchJobs;
    private final CountyConfigRepository counties;
    private final AdapterRegistry adapters;
    private final DiagnosticsService diagnostics;
    private final PipelineProperties properties;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public PipelineMaintenanceService(
        SearchJobRepository searchJobs,
        CountyConfigRepository counties,
        AdapterRegistry adapters,
        DiagnosticsService diagnostics,
        PipelineProperties properties,
        @Qualifier("maintenanceScheduler") ScheduledExecutorService scheduler
    ) {
        this.searchJobs = searchJobs;
        this.counties = counties;
        this.adapters = adapters;
        this.diagnostics = diagnostics;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void startIfEnabled() {
        PipelineProperties.Maintenance settings = properties.getMaintenance();
        if (!settings.isEnabled()) {
            log.info("Pipeline maintenance disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        long sweepMinutes = settings.getStaleSweepIntervalMinutes();
        long healthMinutes = settings.getHealthCheckIntervalMinutes();
        synchronized (scheduled) {
            scheduled.add(scheduler.scheduleWithFixedDelay(
                () -> runSafely("stale search sweep", this::sweepStaleSearches),
                sweepMinutes,
                sweepMinutes,
                TimeUnit.MINUTES
            ));
            scheduled.add(scheduler.scheduleWithFixedDelay(
                () -> runSafely("county health check", this::checkCountyHealth),
                healthMinutes,
                healthMinutes,
                TimeUnit.MINUTES
            ));
        }
        log.info("Pipeline maintenance started sweepEvery={}m healthEvery={}m", sweepMinutes, healthMinutes);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (scheduled) {
            for (ScheduledFuture<?> future : scheduled) {
                future.cancel(false);
            }
            scheduled.clear();
        }
    }

    /**
     * Fails every search that has been in a non-terminal status for longer than the configured
     * window. Returns how many searches were failed.
     */
    public int sweepStaleSearches() {
        int hours = properties.getMaintenance().getStaleSearchHours();
        Instant cutoff = Instant.now().minus(Duration.ofHours(hours));
        List<Long> stale = searchJobs.findInFlightStartedBefore(cutoff);
        int failed = 0;
        for (Long searchId : stale) {
            String error = "TaskTimeoutException: Search exceeded " + hours + "h processing timeout";
            ErrorDiagnosis diagnosis = diagnostics.record(searchId, CLEANUP_STAGE, error, 0);
            if (searchJobs.markFailed(searchId, diagnosis.userMessage())) {
                failed++;
                log.warn("Failed stale search {} after {}h in flight", searchId, hours);
            }
        }
        return failed;
    }

    /**
     * Marks counties unhealthy once they cross the failure threshold and re-checks unhealthy ones
     * so a recovered site is put back into rotation. Returns how many counties changed state.
     */
    public int checkCountyHealth() {
        int threshold = properties.getMaintenance().getUnhealthyFailureThreshold();
        int changed = 0;
        for (CountyConfig county : counties.findAll()) {
            if (county.healthy()) {
                if (county.consecutiveFailures() >= threshold) {
                    counties.markHealth(county.id(), false);
                    log.warn(
                        "County {} marked unhealthy after {} consecutive failures",
                        county.countyName(),
                        county.consecutiveFailures()
                    );
                    changed++;
                }
                continue;
            }
            if (isReachable(county)) {
                counties.markHealth(county.id(), true);
                log.info("County {} recorder is reachable again", county.countyName());
                changed++;
            }
        }
        return changed;
    }

    public boolean isRunning() {
        return running.get();
    }

    private boolean isReachable(CountyConfig county) {
        RecorderAdapter adapter;
        try {
            adapter = adapters.recorderFor(county);
        } catch (RecorderUnavailableException e) {
            log.debug("Skipping health check for {}: {}", county.countyName(), e.getMessage());
            return false;
        }
        return adapter.checkHealth();
    }

    private void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Pipeline maintenance task '{}' failed", name, e);
        }
    }
}
