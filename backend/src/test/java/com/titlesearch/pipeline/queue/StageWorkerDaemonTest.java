package com.titlesearch.pipeline.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.StageTaskRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class StageWorkerDaemonTest {

    @Autowired
    private StageTaskRepository repository;

    @Autowired
    private StageRetryPolicy retryPolicy;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PipelineProperties properties;

    @Autowired
    private JdbcStageTaskQueue queue;

    @Test
    void successfulTaskStoresItsOutcome() {
        RecordingHandler handler = new RecordingHandler("echo_ok", 2, null);
        StageWorkerDaemon daemon = daemon(handler);
        String queueName = uniqueQueue();
        String handle = queue.submit("echo_ok", 1L, null, null, queueName, Duration.ZERO);

        assertThat(daemon.runOnce(queueName)).isTrue();

        StageOutcome outcome = queue.getResult(handle, Duration.ofSeconds(1));
        assertThat(outcome.message()).isEqualTo("done");
        assertThat(handler.failures).isEmpty();
    }

    @Test
    void transientFailureIsRescheduledWithBackoff() {
        RecordingHandler handler = new RecordingHandler("flaky_fetch", 2, new IOException("connection reset"));
        StageWorkerDaemon daemon = daemon(handler);
        String queueName = uniqueQueue();
        String handle = queue.submit("flaky_fetch", 2L, null, null, queueName, Duration.ZERO);

        daemon.runOnce(queueName);

        StageTask task = repository.findById(Long.parseLong(handle));
        assertThat(task.state()).isEqualTo(TaskState.QUEUED);
        assertThat(task.attempts()).isEqualTo(1);
        assertThat(task.nextRunAt()).isAfter(Instant.now().plusSeconds(20));
        assertThat(task.lastError()).isEqualTo("IOException: connection reset");
        assertThat(handler.failures).containsExactly("retry");
        assertThat(daemon.runOnce(queueName)).isFalse();
    }

    @Test
    void nonTransientFailureFailsTheTaskImmediately() {
        RecordingHandler handler = new RecordingHandler(
            "broken_scrape", 3, new IllegalStateException("captcha challenge on results page")
        );
        StageWorkerDaemon daemon = daemon(handler);
        String queueName = uniqueQueue();
        String handle = queue.submit("broken_scrape", 3L, null, null, queueName, Duration.ZERO);

        daemon.runOnce(queueName);

        assertThat(repository.findById(Long.parseLong(handle)).state()).isEqualTo(TaskState.FAILED);
        assertThat(handler.failures).containsExactly("final");
    }

    @Test
    void handlersWithoutRetriesFailOnFirstError() {
        RecordingHandler handler = new RecordingHandler("single_shot", 0, new IOException("connection reset"));
        StageWorkerDaemon daemon = daemon(handler);
        String queueName = uniqueQueue();
        String handle = queue.submit("single_shot", 4L, null, null, queueName, Duration.ZERO);

        daemon.runOnce(queueName);

        assertThat(repository.findById(Long.parseLong(handle)).state()).isEqualTo(TaskState.FAILED);
        assertThat(handler.failures).containsExactly("final");
    }

    @Test
    void unknownTaskNameIsFailed() {
        StageWorkerDaemon daemon = daemon(new RecordingHandler("echo_ok", 0, null));
        String queueName = uniqueQueue();
        String handle = queue.submit("nobody_handles_this", 5L, null, null, queueName, Duration.ZERO);

        daemon.runOnce(queueName);

        StageTask task = repository.findById(Long.parseLong(handle));
        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.lastError()).contains("No handler registered");
    }

    @Test
    void duplicateHandlersAreRejected() {
        assertThatThrownBy(() -> daemon(
            new RecordingHandler("echo_ok", 0, null),
            new RecordingHandler("echo_ok", 1, null)
        )).isInstanceOf(IllegalStateException.class);
    }

    private StageWorkerDaemon daemon(StageTaskHandler... handlers) {
        return new StageWorkerDaemon(repository, retryPolicy, objectMapper, properties, List.of(handlers));
    }

    private static String uniqueQueue() {
        return "worker-test-" + ThreadLocalRandom.current().nextInt(1_000_000);
    }

    private static final class RecordingHandler implements StageTaskHandler {
        private final String taskName;
        private final int maxRetries;
        private final Exception failure;
        private final List<String> failures = new ArrayList<>();

        private RecordingHandler(String taskName, int maxRetries, Exception failure) {
            this.taskName = taskName;
            this.maxRetries = maxRetries;
            this.failure = failure;
        }

        @Override
        public String taskName() {
            return taskName;
        }

        @Override
        public int maxRetries() {
            return maxRetries;
        }

        @Override
        public StageOutcome handle(StageTask task) throws Exception {
            if (failure != null) {
                throw failure;
            }
            return StageOutcome.success("done");
        }

        @Override
        public void onFailure(StageTask task, String error, boolean willRetry) {
            failures.add(willRetry ? "retry" : "final");
        }
    }
}
