package com.titlesearch.pipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.StageTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

@Component
public class JdbcStageTaskQueue implements StageTaskQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcStageTaskQueue.class);

    private final StageTaskRepository repository;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public JdbcStageTaskQueue(StageTaskRepository repository, ObjectMapper objectMapper, PipelineProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String submit(String taskName, long searchId, Long itemId, String payload, String queueName, Duration delay) {
        Duration safeDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        long id = repository.insertTask(taskName, queueName, searchId, itemId, payload, Instant.now().plus(safeDelay));
        log.debug("Submitted task {} ({}) for search {} on queue {}", id, taskName, searchId, queueName);
        return String.valueOf(id);
    }

    @Override
    public StageOutcome getResult(String handle, Duration timeout) {
        long taskId = parseHandle(handle);
        Instant deadline = Instant.now().plus(timeout);
        int pollIntervalMs = properties.getQueue().getResultPollIntervalMs();
        while (true) {
            StageTask task = repository.findById(taskId);
            if (task == null) {
                throw new TaskFailedException("Task " + handle + " not found");
            }
            switch (task.state()) {
                case SUCCEEDED:
                    return readOutcome(task);
                case FAILED:
                    throw new TaskFailedException(task.lastError() == null
                        ? "Task " + task.taskName() + " failed"
                        : task.lastError());
                case REVOKED:
                    throw new TaskFailedException("Task " + task.taskName() + " was revoked");
                default:
                    break;
            }
            if (!Instant.now().isBefore(deadline)) {
                throw new TaskTimeoutException(
                    "Timed out after " + timeout.toSeconds() + "s waiting for task " + task.taskName()
                );
            }
            try {
                TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskFailedException("Interrupted while waiting for task " + task.taskName());
            }
        }
    }

    @Override
    public boolean revoke(String handle) {
        if (handle == null || handle.isBlank()) {
            return false;
        }
        try {
            return repository.revoke(parseHandle(handle));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring revoke for malformed task handle {}", handle);
            return false;
        }
    }

    private StageOutcome readOutcome(StageTask task) {
        if (task.resultJson() == null || task.resultJson().isBlank()) {
            return StageOutcome.success(null);
        }
        try {
            return objectMapper.readValue(task.resultJson(), StageOutcome.class);
        } catch (JsonProcessingException e) {
            throw new TaskFailedException("Unreadable result for task " + task.id() + ": " + e.getOriginalMessage());
        }
    }

    private long parseHandle(String handle) {
        try {
            return Long.parseLong(handle.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid task handle: " + handle, e);
        }
    }
}
