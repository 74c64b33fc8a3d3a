package com.titlesearch.pipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.StageTaskRepository;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import com.titlesearch.pipeline.recovery.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker threads that drain the task queues. Each queue gets its configured number of workers,
 * each running a claim, execute, sleep loop. While a handler runs, its task lock is renewed at a
 * third of the lock TTL so a long step is never handed to a second worker.
 */
@Service
public class StageWorkerDaemon {
    private static final Logger log = LoggerFactory.getLogger(StageWorkerDaemon.class);

    private final StageTaskRepository repository;
    private final StageRetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final Map<String, StageTaskHandler> handlers = new HashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;
    private final ScheduledExecutorService lockRenewer = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable);
        thread.setName("stage-lock-renewer");
        thread.setDaemon(true);
        return thread;
    });

    private ExecutorService executor;

    public StageWorkerDaemon(
        StageTaskRepository repository,
        StageRetryPolicy retryPolicy,
        ObjectMapper objectMapper,
        PipelineProperties properties,
        List<StageTaskHandler> handlers
    ) {
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.properties = properties;
        for (StageTaskHandler handler : handlers) {
            StageTaskHandler previous = this.handlers.put(handler.taskName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for task " + handler.taskName());
            }
        }
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getQueue().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
        lockRenewer.shutdownNow();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            Map<String, Integer> workers = new LinkedHashMap<>();
            for (Map.Entry<String, Integer> entry : properties.getQueue().getWorkers().entrySet()) {
                int count = entry.getValue() == null ? 0 : entry.getValue();
                if (count > 0) {
                    workers.put(entry.getKey(), count);
                }
            }
            int total = workers.values().stream().mapToInt(Integer::intValue).sum();
            if (total == 0) {
                log.warn("Task queue enabled but no workers configured");
                return;
            }
            int pollIntervalMs = properties.getQueue().getPollIntervalMs();
            long lockTtlSeconds = properties.getQueue().getLockTtlSeconds();
            executor = Executors.newFixedThreadPool(total, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("stage-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (Map.Entry<String, Integer> entry : workers.entrySet()) {
                for (int i = 0; i < entry.getValue(); i++) {
                    String queueName = entry.getKey();
                    int workerIndex = i + 1;
                    executor.submit(() -> workerLoop(queueName, workerIndex, pollIntervalMs, lockTtlSeconds));
                }
            }
            log.info("Started {} stage workers across queues {}", total, workers.keySet());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
        }
    }

    /**
     * Claims and executes at most one due task from {@code queueName} on the calling thread.
     *
     * @return true when a task was claimed
     */
    public boolean runOnce(String queueName) {
        long lockTtlSeconds = properties.getQueue().getLockTtlSeconds();
        StageTask task = repository.claimNext(queueName, lockOwner(queueName, 0), lockTtlSeconds);
        if (task == null) {
            return false;
        }
        execute(task, lockTtlSeconds);
        return true;
    }

    void execute(StageTask task, long lockTtlSeconds) {
        StageTaskHandler handler = handlers.get(task.taskName());
        if (handler == null) {
            log.warn("No handler registered for task {} ({})", task.id(), task.taskName());
            repository.markFailed(task.id(), task.lockOwner(), "No handler registered for task " + task.taskName());
            return;
        }
        StageOutcome outcome;
        ScheduledFuture<?> heartbeat = startHeartbeat(task, lockTtlSeconds);
        try {
            outcome = handler.handle(task);
        } catch (Exception e) {
            heartbeat.cancel(false);
            handleFailure(handler, task, e);
            return;
        }
        heartbeat.cancel(false);
        if (!repository.markSucceeded(task.id(), task.lockOwner(), writeOutcome(task, outcome))) {
            log.warn("Task {} ({}) finished after losing its lock; result discarded", task.id(), task.taskName());
        }
    }

    private ScheduledFuture<?> startHeartbeat(StageTask task, long lockTtlSeconds) {
        long periodSeconds = Math.max(1, lockTtlSeconds / 3);
        return lockRenewer.scheduleAtFixedRate(
            () -> {
                try {
                    if (!repository.renewLock(task.id(), task.lockOwner(), lockTtlSeconds)) {
                        log.warn("Task {} ({}) no longer holds its lock", task.id(), task.taskName());
                    }
                } catch (Exception e) {
                    log.warn("Failed to renew lock on task {}", task.id(), e);
                }
            },
            periodSeconds,
            periodSeconds,
            TimeUnit.SECONDS
        );
    }

    private void handleFailure(StageTaskHandler handler, StageTask task, Exception error) {
        String description = ErrorClassifier.describe(error);
        RetryDecision decision = retryPolicy.decide(description, task.attempts(), handler.maxRetries());
        log.warn(
            "Task {} ({}) for search {} failed on attempt {}: {}",
            task.id(),
            task.taskName(),
            task.searchId(),
            task.attempts() + 1,
            description
        );
        try {
            handler.onFailure(task, description, decision.retry());
        } catch (Exception e) {
            log.warn("Failure hook for task {} raised", task.id(), e);
        }
        if (decision.retry()) {
            int jitterMs = ThreadLocalRandom.current().nextInt(0, 1000);
            Instant nextRunAt = Instant.now().plusSeconds(decision.delaySeconds()).plusMillis(jitterMs);
            if (!repository.reschedule(task.id(), task.lockOwner(), nextRunAt, description)) {
                log.warn("Task {} lost its lock before it could be rescheduled", task.id());
            }
        } else if (!repository.markFailed(task.id(), task.lockOwner(), description)) {
            log.warn("Task {} lost its lock before its failure was recorded", task.id());
        }
    }

    private String writeOutcome(StageTask task, StageOutcome outcome) {
        if (outcome == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize outcome of task {}", task.id(), e);
            return null;
        }
    }

    private void workerLoop(String queueName, int workerIndex, int pollIntervalMs, long lockTtlSeconds) {
        Thread.currentThread().setName("stage-worker-" + queueName + "-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            StageTask task;
            try {
                task = repository.claimNext(queueName, lockOwner(queueName, workerIndex), lockTtlSeconds);
            } catch (Exception e) {
                log.warn("Worker {}-{} failed to claim task", queueName, workerIndex, e);
                sleep(pollIntervalMs);
                continue;
            }

            if (task == null) {
                sleep(pollIntervalMs);
                continue;
            }

            try {
                execute(task, lockTtlSeconds);
            } catch (Exception e) {
                log.warn("Worker {}-{} failed while executing task {}", queueName, workerIndex, task.id(), e);
                recordUnexpectedFailure(task, e);
            }
        }
    }

    private void recordUnexpectedFailure(StageTask task, Exception error) {
        try {
            repository.markFailed(task.id(), task.lockOwner(), ErrorClassifier.describe(error));
        } catch (Exception ex) {
            log.warn("Failed to record worker failure for task {}", task.id(), ex);
        }
    }

    /** Worker index 0 is the caller of {@link #runOnce}. */
    private String lockOwner(String queueName, int workerIndex) {
        return instanceId + "/" + queueName + "-" + workerIndex;
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(50, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
