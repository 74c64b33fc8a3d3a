package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatus;
import com.titlesearch.pipeline.recovery.ErrorCategory;
import com.titlesearch.pipeline.recovery.RecoveryAction;
import com.titlesearch.pipeline.recovery.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SearchJobRepositoryTest {

    @Autowired
    private SearchJobRepository repository;

    @Test
    void newSearchStartsPendingWithReferenceNumber() {
        long searchId = newSearch(SearchPriority.HIGH);

        SearchJob job = repository.findById(searchId);

        assertThat(job.status()).isEqualTo(SearchStatus.PENDING);
        assertThat(job.priority()).isEqualTo(SearchPriority.HIGH);
        assertThat(job.referenceNumber()).matches("TS-\\d{4}-\\d{5,}");
        assertThat(job.errorLog()).isEmpty();
        assertThat(repository.findProperty(job.propertyId()).state()).isEqualTo("CO");
    }

    @Test
    void progressNeverMovesBackwards() {
        long searchId = newSearch(SearchPriority.NORMAL);
        repository.markQueued(searchId, "Search queued");

        repository.updateProgress(searchId, SearchStatus.ANALYZING, 60, "Analyzing documents...");
        repository.updateProgress(searchId, null, 45, "Downloading documents...");

        SearchJob job = repository.findById(searchId);
        assertThat(job.progressPercent()).isEqualTo(60);
        assertThat(job.status()).isEqualTo(SearchStatus.ANALYZING);
        assertThat(job.statusMessage()).isEqualTo("Downloading documents...");
    }

    @Test
    void terminalStatusIgnoresLateStageUpdates() {
        long searchId = newSearch(SearchPriority.NORMAL);
        repository.markQueued(searchId, "Search queued");
        assertThat(repository.markCancelled(searchId)).isTrue();

        assertThat(repository.updateProgress(searchId, SearchStatus.GENERATING, 85, "late")).isFalse();
        assertThat(repository.markCompleted(searchId, "late")).isFalse();
        assertThat(repository.markFailed(searchId, "late")).isFalse();
        assertThat(repository.findStatus(searchId)).isEqualTo(SearchStatus.CANCELLED);
    }

    @Test
    void completionSetsFullProgressAndTimestamp() {
        long searchId = newSearch(SearchPriority.NORMAL);
        repository.markQueued(searchId, "Search queued");

        assertThat(repository.markCompleted(searchId, "Search completed successfully")).isTrue();

        SearchJob job = repository.findById(searchId);
        assertThat(job.status()).isEqualTo(SearchStatus.COMPLETED);
        assertThat(job.progressPercent()).isEqualTo(100);
        assertThat(job.completedAt()).isNotNull();
    }

    @Test
    void diagnosticsAppendInOrder() {
        long searchId = newSearch(SearchPriority.NORMAL);

        repository.appendDiagnostic(searchId, entry("scrape", ErrorCategory.NETWORK));
        repository.appendDiagnostic(searchId, entry("download", ErrorCategory.TIMEOUT));

        assertThat(repository.findById(searchId).errorLog())
            .extracting(DiagnosticEntry::stage)
            .containsExactly("scrape", "download");
        assertThat(repository.findById(searchId).errorLog().get(1).category()).isEqualTo(ErrorCategory.TIMEOUT);
    }

    @Test
    void retryResetsProgressAndCountsResumption() {
        long searchId = newSearch(SearchPriority.NORMAL);
        repository.markQueued(searchId, "Search queued");
        repository.updateProgress(searchId, SearchStatus.SCRAPING, 30, "Scraped");
        repository.markFailed(searchId, "Network connectivity issue. Will retry automatically.");

        assertThat(repository.resetForRetry(searchId, "Retrying from step: scrape")).isTrue();
        assertThat(repository.resetForRetry(searchId, "again")).isFalse();

        SearchJob job = repository.findById(searchId);
        assertThat(job.status()).isEqualTo(SearchStatus.PENDING);
        assertThat(job.progressPercent()).isZero();
        assertThat(job.retryCount()).isEqualTo(1);
    }

    @Test
    void partialResultsOnlyFromFailed() {
        long searchId = newSearch(SearchPriority.NORMAL);
        assertThat(repository.acceptPartialResults(searchId, "Completed with partial results")).isFalse();

        repository.markQueued(searchId, "Search queued");
        repository.markFailed(searchId, "failed");
        assertThat(repository.acceptPartialResults(searchId, "Completed with partial results")).isTrue();
        assertThat(repository.findStatus(searchId)).isEqualTo(SearchStatus.COMPLETED);
    }

    @Test
    void staleInFlightSearchesAreFound() {
        long searchId = newSearch(SearchPriority.NORMAL);
        repository.markQueued(searchId, "Search queued");

        assertThat(repository.findInFlightStartedBefore(Instant.now().plusSeconds(60))).contains(searchId);
        assertThat(repository.findInFlightStartedBefore(Instant.now().minusSeconds(3600))).doesNotContain(searchId);
    }

    private long newSearch(SearchPriority priority) {
        long propertyId = repository.insertProperty("1437 Bannock St", "Denver", "Denver", null, "80202", "0503228001000");
        return repository.insertSearch(propertyId, priority, 40);
    }

    private static DiagnosticEntry entry(String stage, ErrorCategory category) {
        return new DiagnosticEntry(
            Instant.now(),
            stage,
            category.wireName() + " failure",
            category,
            Severity.MEDIUM,
            category.isTransient(),
            RecoveryAction.RETRY
        );
    }
}
