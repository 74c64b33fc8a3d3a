package com.titlesearch.pipeline.queue;

import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.StageTaskRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcStageTaskQueueTest {

    @Autowired
    private JdbcStageTaskQueue queue;

    @Autowired
    private StageTaskRepository repository;

    @Test
    void submittedTaskIsClaimedOnlyFromItsOwnQueue() {
        String queueName = uniqueQueue();
        String handle = queue.submit(TaskNames.DOWNLOAD_DOCUMENT, 41L, 7L, null, queueName, Duration.ZERO);

        assertThat(repository.claimNext(uniqueQueue(), "worker-a", 60)).isNull();
        StageTask claimed = repository.claimNext(queueName, "worker-a", 60);

        assertThat(claimed).isNotNull();
        assertThat(claimed.handle()).isEqualTo(handle);
        assertThat(claimed.state()).isEqualTo(TaskState.RUNNING);
        assertThat(claimed.itemId()).isEqualTo(7L);
        assertThat(claimed.lockOwner()).isEqualTo("worker-a");
        assertThat(repository.claimNext(queueName, "worker-b", 60)).isNull();
    }

    @Test
    void delayedTaskIsNotDueYet() {
        String queueName = uniqueQueue();
        queue.submit(TaskNames.PIPELINE_STEP, 42L, null, "download", queueName, Duration.ofMinutes(5));

        assertThat(repository.claimNext(queueName, "worker-a", 60)).isNull();
        assertThat(repository.countByState(queueName, TaskState.QUEUED)).isEqualTo(1);
    }

    @Test
    void succeededTaskReturnsStoredOutcome() {
        String queueName = uniqueQueue();
        String handle = queue.submit(TaskNames.ANALYZE_DOCUMENT, 43L, 3L, null, queueName, Duration.ZERO);
        StageTask claimed = repository.claimNext(queueName, "worker-a", 60);
        repository.markSucceeded(
            claimed.id(),
            "worker-a",
            "{\"status\":\"success\",\"total\":1,\"succeeded\":1,\"failed\":0,\"message\":\"Analyzed\"}"
        );

        StageOutcome outcome = queue.getResult(handle, Duration.ofSeconds(1));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.succeeded()).isEqualTo(1);
        assertThat(outcome.message()).isEqualTo("Analyzed");
    }

    @Test
    void failedTaskSurfacesLastError() {
        String queueName = uniqueQueue();
        String handle = queue.submit(TaskNames.DOWNLOAD_DOCUMENT, 44L, 9L, null, queueName, Duration.ZERO);
        StageTask claimed = repository.claimNext(queueName, "worker-a", 60);
        repository.markFailed(claimed.id(), "worker-a", "DocumentDownloadException: No file for instrument 2020-1");

        assertThatThrownBy(() -> queue.getResult(handle, Duration.ofSeconds(1)))
            .isInstanceOf(TaskFailedException.class)
            .hasMessage("DocumentDownloadException: No file for instrument 2020-1");
        assertThat(repository.findById(claimed.id()).attempts()).isEqualTo(1);
    }

    @Test
    void waitingPastTheDeadlineIsATimeout() {
        String handle = queue.submit(TaskNames.GENERATE_REPORT, 45L, null, null, uniqueQueue(), Duration.ZERO);

        assertThatThrownBy(() -> queue.getResult(handle, Duration.ofMillis(30)))
            .isInstanceOf(TaskTimeoutException.class)
            .hasMessageStartingWith("Timed out after");
    }

    @Test
    void revokedTaskCannotBeClaimedOrAwaited() {
        String queueName = uniqueQueue();
        String handle = queue.submit(TaskNames.SCRAPE_COUNTY_RECORDS, 46L, null, null, queueName, Duration.ZERO);

        assertThat(queue.revoke(handle)).isTrue();
        assertThat(queue.revoke(handle)).isFalse();
        assertThat(repository.claimNext(queueName, "worker-a", 60)).isNull();
        assertThatThrownBy(() -> queue.getResult(handle, Duration.ofSeconds(1)))
            .isInstanceOf(TaskFailedException.class)
            .hasMessageContaining("was revoked");
    }

    @Test
    void rescheduledTaskKeepsItsAttemptCount() {
        String queueName = uniqueQueue();
        queue.submit(TaskNames.DOWNLOAD_DOCUMENT, 47L, 1L, null, queueName, Duration.ZERO);
        StageTask claimed = repository.claimNext(queueName, "worker-a", 60);
        repository.reschedule(claimed.id(), "worker-a", java.time.Instant.now().minusSeconds(1), "connection reset");

        StageTask again = repository.claimNext(queueName, "worker-b", 60);

        assertThat(again.id()).isEqualTo(claimed.id());
        assertThat(again.attempts()).isEqualTo(1);
        assertThat(again.lastError()).isEqualTo("connection reset");
    }

    @Test
    void completionFromAWorkerThatLostItsLockIsRejected() throws InterruptedException {
        String queueName = uniqueQueue();
        String handle = queue.submit(TaskNames.PIPELINE_STEP, 48L, null, "analyze", queueName, Duration.ZERO);
        StageTask first = repository.claimNext(queueName, "worker-a", 1);
        Thread.sleep(1500);

        StageTask second = repository.claimNext(queueName, "worker-b", 60);

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(repository.markSucceeded(first.id(), "worker-a", null)).isFalse();
        assertThat(repository.reschedule(first.id(), "worker-a", java.time.Instant.now(), "late")).isFalse();
        assertThat(repository.markFailed(first.id(), "worker-a", "late")).isFalse();
        assertThat(repository.findById(first.id()).lockOwner()).isEqualTo("worker-b");
        assertThat(repository.findById(first.id()).state()).isEqualTo(TaskState.RUNNING);

        assertThat(repository.markSucceeded(second.id(), "worker-b", null)).isTrue();
        assertThat(repository.findById(Long.parseLong(handle)).state()).isEqualTo(TaskState.SUCCEEDED);
    }

    @Test
    void renewedLockKeepsTheTaskAwayFromOtherWorkers() throws InterruptedException {
        String queueName = uniqueQueue();
        queue.submit(TaskNames.PIPELINE_STEP, 49L, null, "download", queueName, Duration.ZERO);
        StageTask claimed = repository.claimNext(queueName, "worker-a", 1);

        Thread.sleep(700);
        assertThat(repository.renewLock(claimed.id(), "worker-a", 2)).isTrue();
        Thread.sleep(800);

        assertThat(repository.claimNext(queueName, "worker-b", 60)).isNull();
        assertThat(repository.renewLock(claimed.id(), "worker-b", 60)).isFalse();
        assertThat(repository.findById(claimed.id()).lockOwner()).isEqualTo("worker-a");
    }

    @Test
    void malformedHandleRevokeIsIgnored() {
        assertThat(queue.revoke("not-a-task")).isFalse();
        assertThat(queue.revoke(null)).isFalse();
    }

    private static String uniqueQueue() {
        return "test-" + ThreadLocalRandom.current().nextInt(1_000_000);
    }
}
