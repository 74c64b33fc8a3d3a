package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.browser.BrowserSession;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.model.DocumentRecord;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CourtSearchStageTest {
    private static final long SEARCH_ID = 5L;

    @Mock
    private SearchJobRepository searchJobs;

    @Mock
    private CountyConfigRepository counties;

    @Mock
    private DocumentRepository documents;

    @Mock
    private AdapterRegistry adapters;

    @Mock
    private DiagnosticsService diagnostics;

    @Mock
    private RecorderAdapter adapter;

    @Mock
    private BrowserSession session;

    private CourtSearchStage stage;

    @BeforeEach
    void setUp() {
        BrowserPool pool = new BrowserPool(() -> session, new PipelineProperties().getBrowser());
        stage = new CourtSearchStage(searchJobs, counties, documents, adapters, pool, diagnostics);
    }

    @Test
    void searchWithoutADeedIsSkipped() {
        when(documents.findBySearch(SEARCH_ID)).thenReturn(List.of());

        StageOutcome outcome = stage.execute(job());

        assertThat(outcome.status()).isEqualTo(StageOutcome.SKIPPED);
        assertThat(outcome.message()).isEqualTo("No owner names found for court search");
        verify(adapters, never()).courtFor(any());
    }

    @Test
    void courtSiteOutageIsKeptAsAWarningAndTheChainCarriesOn() {
        givenCourtSite();
        when(adapter.initialize(session)).thenReturn(false);

        StageOutcome outcome = stage.execute(job());

        assertThat(outcome.status()).isEqualTo(StageOutcome.SKIPPED);
        assertThat(outcome.message()).startsWith("Court records unavailable");
        verify(diagnostics).recordWarning(
            SEARCH_ID,
            "court-search",
            "RecorderUnavailableException: Court records website unavailable for Denver County"
        );
        verify(diagnostics, never()).record(anyLong(), anyString(), anyString(), anyInt());
        verify(documents, never()).insertDocument(anyLong(), any(), any());
    }

    @Test
    void closedCasesAreStoredWithoutEncumbering() {
        givenCourtSite();
        when(adapter.initialize(session)).thenReturn(true);
        when(adapter.searchByName(eq(session), anyString(), any())).thenAnswer(invocation ->
            "JANE DOE".equals(invocation.getArgument(1))
                ? List.of(
                    courtResult("C-1", DocumentType.JUDGMENT, "Dismissed"),
                    courtResult("C-2", DocumentType.LIS_PENDENS, "open"),
                    courtResult("C-3", DocumentType.OTHER, null),
                    courtResult("C-4", DocumentType.JUDGMENT, "open")
                )
                : List.of()
        );
        when(documents.existsInstrument(eq(SEARCH_ID), anyString(), eq(DocumentSource.COURT_RECORDS)))
            .thenAnswer(invocation -> "C-4".equals(invocation.getArgument(1)));

        StageOutcome outcome = stage.execute(job());

        ArgumentCaptor<SearchResult> stored = ArgumentCaptor.forClass(SearchResult.class);
        verify(documents, times(3)).insertDocument(eq(SEARCH_ID), stored.capture(), eq(DocumentSource.COURT_RECORDS));
        assertThat(stored.getAllValues())
            .extracting(SearchResult::instrumentNumber, SearchResult::documentType)
            .containsExactly(
                tuple("C-1", DocumentType.COURT_CASE),
                tuple("C-2", DocumentType.LIS_PENDENS),
                tuple("C-3", DocumentType.COURT_CASE)
            );
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.total()).isEqualTo(4);
        assertThat(outcome.succeeded()).isEqualTo(3);
        verify(adapter).searchByName(eq(session), eq("JOHN DOE"), any());
    }

    @Test
    void ownersComeFromTheLatestDeed() {
        List<String> owners = CourtSearchStage.currentOwnerNames(List.of(
            deed(1L, DocumentType.WARRANTY_DEED, LocalDate.of(2001, 4, 2), "OLD OWNER"),
            deed(2L, DocumentType.WARRANTY_DEED, LocalDate.of(2016, 9, 30), "JANE DOE; JOHN DOE"),
            deed(3L, DocumentType.TAX_LIEN, LocalDate.of(2020, 1, 1), "COUNTY TREASURER")
        ));

        assertThat(owners).containsExactly("JANE DOE", "JOHN DOE");
    }

    private void givenCourtSite() {
        CountyConfig county = new CountyConfig(
            3L, "Denver", "CO", "https://recorder.example", "https://courts.example", "generic",
            30, 2000, true, true, 0, null, null
        );
        when(documents.findBySearch(SEARCH_ID)).thenReturn(List.of(
            deed(1L, DocumentType.WARRANTY_DEED, LocalDate.of(2016, 9, 30), "JANE DOE; JOHN DOE")
        ));
        when(searchJobs.findProperty(1L)).thenReturn(
            new PropertyTarget(1L, "1437 Bannock St", "Denver", "Denver", "CO", "80202", null)
        );
        when(counties.findByName("Denver", "CO")).thenReturn(county);
        when(adapters.courtFor(county)).thenReturn(adapter);
    }

    private static SearchResult courtResult(String caseNumber, DocumentType type, String status) {
        return new SearchResult(
            caseNumber, type, LocalDate.of(2021, 3, 8), List.of("FIRST BANK"), List.of("JANE DOE"),
            null, null, status == null ? Map.of() : Map.of("status", status)
        );
    }

    private static DocumentRecord deed(long id, DocumentType type, LocalDate recorded, String grantee) {
        return new DocumentRecord(
            id, SEARCH_ID, type, DocumentSource.COUNTY_RECORDER, "INST-" + id, null, recorded,
            "SELLER", grantee, null, null, null, null, null, false, null
        );
    }

    private static SearchJob job() {
        return new SearchJob(
            SEARCH_ID, "TS-2026-00005", 1L, SearchStatus.SCRAPING, "Searching court records...", 40,
            SearchPriority.NORMAL, 0, List.of(), null, 40, Instant.now(), Instant.now(), null
        );
    }
}
