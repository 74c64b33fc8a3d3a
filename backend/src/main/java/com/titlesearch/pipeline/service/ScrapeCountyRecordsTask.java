package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.DateRange;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.adapter.RecorderUnavailableException;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.PropertyTarget;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Scrapes the county recorder for a search's property, by parcel number when one is known and by
 * street address otherwise, and stores every new instrument as a document.
 */
@Component
public class ScrapeCountyRecordsTask implements StageTaskHandler {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCountyRecordsTask.class);

    private final SearchJobRepository searchJobs;
    private final CountyConfigRepository counties;
    private final DocumentRepository documents;
    private final AdapterRegistry adapters;
    private final BrowserPool browserPool;
    private final PipelineProperties properties;

    public ScrapeCountyRecordsTask(
        SearchJobRepository searchJobs,
        CountyConfigRepository counties,
        DocumentRepository documents,
        AdapterRegistry adapters,
        BrowserPool browserPool,
        PipelineProperties properties
    ) {
        this.searchJobs = searchJobs;
        this.counties = counties;
        this.documents = documents;
        this.adapters = adapters;
        this.browserPool = browserPool;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.SCRAPE_COUNTY_RECORDS;
    }

    @Override
    public int maxRetries() {
        return properties.getRetry().getScrapeMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) {
        SearchJob job = searchJobs.findById(task.searchId());
        if (job == null || job.status().isTerminal()) {
            return StageOutcome.skipped("Search " + task.searchId() + " is no longer active");
        }
        PropertyTarget property = searchJobs.findProperty(job.propertyId());
        if (property == null) {
            throw new IllegalStateException("Invalid search: property " + job.propertyId() + " not found");
        }
        CountyConfig county = counties.findByName(property.county(), property.state());
        if (county == null) {
            throw new RecorderUnavailableException(
                "Recorder website unavailable: " + property.county() + " County is not configured"
            );
        }
        if (!county.scrapingEnabled()) {
            return StageOutcome.skipped("Scraping disabled for " + county.countyName() + " County");
        }

        RecorderAdapter adapter = adapters.recorderFor(county);
        DateRange range = DateRange.lastYears(job.searchYears(), LocalDate.now());
        List<SearchResult> results;
        try {
            results = browserPool.withSession(affinityKey(county), session -> {
                if (!adapter.initialize(session)) {
                    throw new RecorderUnavailableException(
                        "Recorder website unavailable for " + county.countyName() + " County"
                    );
                }
                List<SearchResult> found = property.hasParcelNumber()
                    ? adapter.searchByParcel(session, property.parcelNumber(), range)
                    : List.of();
                if (found.isEmpty()) {
                    found = adapter.searchByAddress(session, property.streetAddress(), range);
                }
                return found;
            });
        } catch (RuntimeException e) {
            counties.recordScrapeFailure(county.id(), properties.getMaintenance().getUnhealthyFailureThreshold());
            throw e;
        }
        counties.recordScrapeSuccess(county.id());

        int inserted = 0;
        for (SearchResult result : results) {
            if (result.instrumentNumber() == null
                || documents.existsInstrument(job.id(), result.instrumentNumber(), DocumentSource.COUNTY_RECORDER)) {
                continue;
            }
            documents.insertDocument(job.id(), result, DocumentSource.COUNTY_RECORDER);
            inserted++;
        }
        log.info(
            "Scraped {} County for search {}: {} results, {} new documents",
            county.countyName(),
            job.id(),
            results.size(),
            inserted
        );
        return StageOutcome.success(results.size(), inserted, 0, "Found " + inserted + " documents");
    }

    static String affinityKey(CountyConfig county) {
        return "recorder:" + county.countyName().toLowerCase(Locale.ROOT);
    }
}
