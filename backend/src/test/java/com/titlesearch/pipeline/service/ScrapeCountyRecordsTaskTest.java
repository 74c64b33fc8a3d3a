package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.adapter.RecorderUnavailableException;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.browser.BrowserSession;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.PropertyTarget;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.model.SearchStatus;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.TaskNames;
import com.titlesearch.pipeline.queue.TaskState;
import com.titlesearch.pipeline.recovery.ErrorCategory;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeCountyRecordsTaskTest {
    private static final long SEARCH_ID = 9L;
    private static final CountyConfig DENVER = new CountyConfig(
        3L, "Denver", "CO", "https://recorder.example", null, "generic",
        30, 2000, true, true, 0, null, null
    );

    @Mock
    private SearchJobRepository searchJobs;

    @Mock
    private CountyConfigRepository counties;

    @Mock
    private DocumentRepository documents;

    @Mock
    private AdapterRegistry adapters;

    @Mock
    private RecorderAdapter adapter;

    @Mock
    private BrowserSession session;

    private final PipelineProperties properties = new PipelineProperties();
    private ScrapeCountyRecordsTask task;

    @BeforeEach
    void setUp() {
        BrowserPool pool = new BrowserPool(() -> session, properties.getBrowser());
        task = new ScrapeCountyRecordsTask(searchJobs, counties, documents, adapters, pool, properties);
    }

    @Test
    void countyWithNoRecordsStillSucceeds() {
        givenSearch("0123-45");
        when(adapter.initialize(session)).thenReturn(true);
        when(adapter.searchByParcel(eq(session), eq("0123-45"), any())).thenReturn(List.of());
        when(adapter.searchByAddress(eq(session), eq("1437 Bannock St"), any())).thenReturn(List.of());

        StageOutcome outcome = task.handle(stageTask());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.total()).isZero();
        assertThat(outcome.succeeded()).isZero();
        assertThat(outcome.message()).isEqualTo("Found 0 documents");
        verify(counties).recordScrapeSuccess(DENVER.id());
        verify(documents, never()).insertDocument(anyLong(), any(), any());
    }

    @Test
    void unconfiguredCountyFailsAsAScrapingError() {
        when(searchJobs.findById(SEARCH_ID)).thenReturn(job());
        when(searchJobs.findProperty(1L)).thenReturn(property(null));
        when(counties.findByName("Denver", "CO")).thenReturn(null);

        Throwable thrown = catchThrowable(() -> task.handle(stageTask()));

        assertThat(thrown).isInstanceOf(RecorderUnavailableException.class);
        assertThat(new ErrorClassifier().categorize(ErrorClassifier.describe(thrown)))
            .isEqualTo(ErrorCategory.SCRAPING);
        verify(counties, never()).recordScrapeFailure(anyLong(), anyInt());
    }

    @Test
    void siteFailureCountsAgainstCountyHealth() {
        givenSearch(null);
        when(adapter.initialize(session)).thenReturn(false);

        Throwable thrown = catchThrowable(() -> task.handle(stageTask()));

        assertThat(thrown)
            .isInstanceOf(RecorderUnavailableException.class)
            .hasMessage("Recorder website unavailable for Denver County");
        verify(counties).recordScrapeFailure(
            DENVER.id(),
            properties.getMaintenance().getUnhealthyFailureThreshold()
        );
        verify(counties, never()).recordScrapeSuccess(anyLong());
    }

    @Test
    void instrumentsAlreadyStoredOrRepeatedAreSkipped() {
        givenSearch("0123-45");
        when(adapter.initialize(session)).thenReturn(true);
        when(adapter.searchByParcel(eq(session), eq("0123-45"), any())).thenReturn(List.of(
            deed("2019-001"),
            deed("2015-777"),
            deed("2019-001"),
            deed(null)
        ));
        Set<String> stored = new HashSet<>(Set.of("2015-777"));
        when(documents.existsInstrument(eq(SEARCH_ID), anyString(), eq(DocumentSource.COUNTY_RECORDER)))
            .thenAnswer(invocation -> stored.contains(invocation.<String>getArgument(1)));
        when(documents.insertDocument(eq(SEARCH_ID), any(), eq(DocumentSource.COUNTY_RECORDER)))
            .thenAnswer(invocation -> {
                stored.add(invocation.<SearchResult>getArgument(1).instrumentNumber());
                return 100L;
            });

        StageOutcome outcome = task.handle(stageTask());

        assertThat(outcome.total()).isEqualTo(4);
        assertThat(outcome.succeeded()).isEqualTo(1);
        assertThat(stored).containsExactlyInAnyOrder("2015-777", "2019-001");
        verify(adapter, never()).searchByAddress(any(), anyString(), any());
    }

    @Test
    void finishedSearchIsNotScraped() {
        when(searchJobs.findById(SEARCH_ID)).thenReturn(new SearchJob(
            SEARCH_ID, "TS-2026-00009", 1L, SearchStatus.CANCELLED, "Cancelled by user", 20,
            SearchPriority.NORMAL, 0, List.of(), null, 40, Instant.now(), Instant.now(), Instant.now()
        ));

        StageOutcome outcome = task.handle(stageTask());

        assertThat(outcome.status()).isEqualTo(StageOutcome.SKIPPED);
        verify(adapters, never()).recorderFor(any());
    }

    private void givenSearch(String parcelNumber) {
        when(searchJobs.findById(SEARCH_ID)).thenReturn(job());
        when(searchJobs.findProperty(1L)).thenReturn(property(parcelNumber));
        when(counties.findByName("Denver", "CO")).thenReturn(DENVER);
        when(adapters.recorderFor(DENVER)).thenReturn(adapter);
    }

    private static PropertyTarget property(String parcelNumber) {
        return new PropertyTarget(1L, "1437 Bannock St", "Denver", "Denver", "CO", "80202", parcelNumber);
    }

    private static SearchResult deed(String instrument) {
        return new SearchResult(
            instrument, DocumentType.WARRANTY_DEED, LocalDate.of(2019, 5, 2), List.of("SELLER"), List.of("BUYER"),
            null, null, null
        );
    }

    private static SearchJob job() {
        return new SearchJob(
            SEARCH_ID, "TS-2026-00009", 1L, SearchStatus.SCRAPING, "Searching county records...", 10,
            SearchPriority.NORMAL, 0, List.of(), null, 40, Instant.now(), Instant.now(), null
        );
    }

    private static StageTask stageTask() {
        Instant now = Instant.now();
        return new StageTask(
            21L, TaskNames.SCRAPE_COUNTY_RECORDS, QueueNames.SCRAPING, SEARCH_ID, null, null,
            TaskState.RUNNING, 0, now, "worker-a", null, null, now, null
        );
    }
}
