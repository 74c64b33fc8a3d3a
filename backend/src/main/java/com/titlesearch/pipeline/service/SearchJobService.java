package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatusView;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;

/**
 * Creates searches and reads their status. Execution is owned by {@link PipelineOrchestrator}.
 */
@Service
public class SearchJobService {
    private static final Logger log = LoggerFactory.getLogger(SearchJobService.class);

    private final SearchJobRepository searchJobs;
    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    public SearchJobService(
        SearchJobRepository searchJobs,
        PipelineOrchestrator orchestrator,
        PipelineProperties properties
    ) {
        this.searchJobs = searchJobs;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Transactional
    public SearchStatusView create(
        String streetAddress,
        String city,
        String county,
        String state,
        String zipCode,
        String parcelNumber,
        SearchPriority priority,
        Integer searchYears
    ) {
        return create(
            streetAddress, city, county, state, zipCode, parcelNumber, priority, searchYears, Duration.ZERO
        );
    }

    /** As {@link #create}, holding the first orchestration task back by {@code startDelay}. */
    @Transactional
    public SearchStatusView create(
        String streetAddress,
        String city,
        String county,
        String state,
        String zipCode,
        String parcelNumber,
        SearchPriority priority,
        Integer searchYears,
        Duration startDelay
    ) {
        requireText(streetAddress, "streetAddress");
        requireText(city, "city");
        requireText(county, "county");
        int years = searchYears == null ? properties.getSearchYears() : searchYears;
        if (years < 1) {
            throw new IllegalArgumentException("searchYears must be at least 1");
        }

        long propertyId = searchJobs.insertProperty(
            streetAddress.trim(),
            city.trim(),
            county.trim(),
            state,
            zipCode,
            parcelNumber
        );
        long searchId = searchJobs.insertSearch(
            propertyId,
            priority == null ? SearchPriority.NORMAL : priority,
            years
        );
        orchestrator.submit(searchId, PipelineStep.first(), startDelay);
        log.info("Created search {} for {}, {} ({} County)", searchId, streetAddress, city, county);
        return status(searchId);
    }

    public SearchStatusView status(long searchId) {
        SearchJob job = searchJobs.findById(searchId);
        if (job == null) {
            throw new SearchNotFoundException(searchId);
        }
        return SearchStatusView.from(job);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
