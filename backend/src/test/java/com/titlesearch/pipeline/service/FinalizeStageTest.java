package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatus;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinalizeStageTest {

    @Mock
    private SearchJobRepository searchJobs;
    @Mock
    private DocumentRepository documents;
    @InjectMocks
    private FinalizeStage stage;

    @Test
    void searchWithoutDocumentsStillCompletes() {
        when(documents.countBySearch(5L)).thenReturn(0);
        when(searchJobs.markCompleted(5L, FinalizeStage.NO_DOCUMENTS_MESSAGE)).thenReturn(true);

        StageOutcome outcome = stage.execute(job());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.total()).isZero();
        assertThat(outcome.message()).isEqualTo(FinalizeStage.NO_DOCUMENTS_MESSAGE);
    }

    @Test
    void alreadyFinishedSearchIsSkipped() {
        when(documents.countBySearch(5L)).thenReturn(3);
        when(searchJobs.markCompleted(5L, "Search completed: 3 documents found")).thenReturn(false);

        StageOutcome outcome = stage.execute(job());

        assertThat(outcome.status()).isEqualTo(StageOutcome.SKIPPED);
    }

    private static SearchJob job() {
        Instant now = Instant.now();
        return new SearchJob(5L, "TS-2026-00005", 1L, SearchStatus.GENERATING, null, 95, SearchPriority.NORMAL,
            0, List.of(), null, 10, now, now, null);
    }
}
