package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.DateRange;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.adapter.RecorderUnavailableException;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.PropertyTarget;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Searches the county's court records for cases against the current owners, taken from the
 * grantees of the most recent deed. Court records are supplementary: any failure here is logged to
 * the search's error log and the chain carries on.
 */
@Component
public class CourtSearchStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(CourtSearchStage.class);
    private static final Set<String> CLOSED_CASE_STATUSES = Set.of(
        "closed", "dismissed", "disposed", "satisfied", "released", "vacated"
    );

    private final SearchJobRepository searchJobs;
    private final CountyConfigRepository counties;
    private final DocumentRepository documents;
    private final AdapterRegistry adapters;
    private final BrowserPool browserPool;
    private final DiagnosticsService diagnostics;

    public CourtSearchStage(
        SearchJobRepository searchJobs,
        CountyConfigRepository counties,
        DocumentRepository documents,
        AdapterRegistry adapters,
        BrowserPool browserPool,
        DiagnosticsService diagnostics
    ) {
        this.searchJobs = searchJobs;
        this.counties = counties;
        this.documents = documents;
        this.adapters = adapters;
        this.browserPool = browserPool;
        this.diagnostics = diagnostics;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.COURT_SEARCH;
    }

    @Override
    public StageOutcome execute(SearchJob job) {
        List<String> owners = currentOwnerNames(documents.findBySearch(job.id()));
        if (owners.isEmpty()) {
            return StageOutcome.skipped("No owner names found for court search");
        }
        try {
            return searchCourtRecords(job, owners);
        } catch (RuntimeException e) {
            String error = ErrorClassifier.describe(e);
            log.warn("Court records search failed for search {}: {}", job.id(), error);
            diagnostics.recordWarning(job.id(), step().wireName(), error);
            return StageOutcome.skipped("Court records unavailable: " + error);
        }
    }

    private StageOutcome searchCourtRecords(SearchJob job, List<String> owners) {
        PropertyTarget property = searchJobs.findProperty(job.propertyId());
        CountyConfig county = property == null ? null : counties.findByName(property.county(), property.state());
        if (county == null) {
            throw new RecorderUnavailableException("Court records website unavailable: county is not configured");
        }
        RecorderAdapter adapter = adapters.courtFor(county);
        DateRange range = DateRange.lastYears(job.searchYears(), LocalDate.now());

        List<SearchResult> results = browserPool.withSession(AdapterRegistry.COURT_RECORDS, session -> {
            if (!adapter.initialize(session)) {
                throw new RecorderUnavailableException(
                    "Court records website unavailable for " + county.countyName() + " County"
                );
            }
            List<SearchResult> found = new ArrayList<>();
            for (String owner : owners) {
                try {
                    found.addAll(adapter.searchByName(session, owner, range));
                } catch (RuntimeException e) {
                    log.warn("Court search for '{}' failed on search {}", owner, job.id(), e);
                }
            }
            return found;
        });

        int inserted = 0;
        for (SearchResult result : results) {
            if (result.instrumentNumber() == null
                || documents.existsInstrument(job.id(), result.instrumentNumber(), DocumentSource.COURT_RECORDS)) {
                continue;
            }
            documents.insertDocument(job.id(), normalizeCaseType(result), DocumentSource.COURT_RECORDS);
            inserted++;
        }
        log.info("Court records for search {}: {} results, {} new", job.id(), results.size(), inserted);
        return StageOutcome.success(results.size(), inserted, 0, "Found " + inserted + " court records");
    }

    static List<String> currentOwnerNames(List<DocumentRecord> records) {
        return records.stream()
            .filter(record -> record.documentType().isConveyance()
                || record.documentType() == DocumentType.DEED_OF_TRUST)
            .filter(record -> record.grantee() != null && !record.grantee().isBlank())
            .max(Comparator.comparing(
                DocumentRecord::recordingDate,
                Comparator.nullsFirst(Comparator.naturalOrder())
            ))
            .map(record -> Arrays.stream(record.grantee().split(";"))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList())
            .orElse(List.of());
    }

    // A closed case is kept as a record but no longer encumbers the title.
    private SearchResult normalizeCaseType(SearchResult result) {
        String status = result.attributes().get("status");
        boolean closed = status != null && CLOSED_CASE_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
        DocumentType type = result.documentType() == null || result.documentType() == DocumentType.OTHER
            ? DocumentType.COURT_CASE
            : result.documentType();
        if (closed && type.isEncumbrance()) {
            type = DocumentType.COURT_CASE;
        }
        return new SearchResult(
            result.instrumentNumber(),
            type,
            result.recordingDate(),
            result.grantor(),
            result.grantee(),
            result.downloadUrl(),
            result.bookPage(),
            result.attributes()
        );
    }
}
