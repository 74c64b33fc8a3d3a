package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.TaskState;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Rows of the {@code stage_tasks} queue table. Claims are optimistic: a candidate is read, then
 * taken with an update that repeats the claim predicate, so two workers never own the same row.
 * Completions only apply while the caller still holds the row's lock.
 */
@Repository
public class StageTaskRepository {
    private static final int CLAIM_CANDIDATES = 5;
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final String COLUMNS = """
        id, task_name, queue_name, search_id, item_id, payload, state, attempts, next_run_at,
        lock_owner, result_json, last_error, created_at, finished_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public StageTaskRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertTask(
        String taskName,
        String queueName,
        long searchId,
        Long itemId,
        String payload,
        Instant runAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskName", taskName)
            .addValue("queueName", queueName)
            .addValue("searchId", searchId)
            .addValue("itemId", itemId)
            .addValue("payload", payload)
            .addValue("runAt", Timestamp.from(runAt))
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO stage_tasks (
                    task_name, queue_name, search_id, item_id, payload, state, attempts,
                    next_run_at, created_at, updated_at
                )
                VALUES (
                    :taskName, :queueName, :searchId, :itemId, :payload, 'QUEUED', 0,
                    :runAt, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    /**
     * Claims the oldest due task on {@code queueName}. A RUNNING task whose lock expired is due
     * again, which recovers work from a worker that died mid-task.
     */
    public StageTask claimNext(String queueName, String lockOwner, long lockTtlSeconds) {
        Instant now = Instant.now();
        Instant lockedUntil = now.plusSeconds(Math.max(1, lockTtlSeconds));
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil))
            .addValue("lockOwner", safeOwner)
            .addValue("limit", CLAIM_CANDIDATES);

        List<Long> candidates = jdbc.query(
            """
                SELECT id
                FROM stage_tasks
                WHERE queue_name = :queueName
                  AND (
                      (state = 'QUEUED' AND next_run_at <= :now)
                      OR (state = 'RUNNING' AND locked_until < :now)
                  )
                ORDER BY next_run_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );

        for (Long candidate : candidates) {
            params.addValue("id", candidate);
            int claimed = jdbc.update(
                """
                    UPDATE stage_tasks
                    SET state = 'RUNNING',
                        locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        updated_at = :now
                    WHERE id = :id
                      AND (
                          (state = 'QUEUED' AND next_run_at <= :now)
                          OR (state = 'RUNNING' AND locked_until < :now)
                      )
                    """,
                params
            );
            if (claimed > 0) {
                return findById(candidate);
            }
        }
        return null;
    }

    /**
     * Pushes {@code locked_until} out by another TTL while {@code lockOwner} still holds the task.
     *
     * @return false once the lock has been lost to another worker or the task left RUNNING
     */
    public boolean renewLock(long taskId, String lockOwner, long lockTtlSeconds) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE stage_tasks
                SET locked_until = :lockedUntil,
                    updated_at = :now
                WHERE id = :id
                  AND state = 'RUNNING'
                  AND lock_owner = :lockOwner
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("lockOwner", lockOwner)
                .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, lockTtlSeconds))))
                .addValue("now", Timestamp.from(now))
        ) > 0;
    }

    public boolean markSucceeded(long taskId, String lockOwner, String resultJson) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE stage_tasks
                SET state = 'SUCCEEDED',
                    result_json = :resultJson,
                    locked_until = NULL,
                    lock_owner = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND state = 'RUNNING'
                  AND lock_owner = :lockOwner
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("lockOwner", lockOwner)
                .addValue("resultJson", resultJson)
                .addValue("now", Timestamp.from(now))
        ) > 0;
    }

    public boolean markFailed(long taskId, String lockOwner, String error) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE stage_tasks
                SET state = 'FAILED',
                    last_error = :lastError,
                    attempts = attempts + 1,
                    locked_until = NULL,
                    lock_owner = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND state = 'RUNNING'
                  AND lock_owner = :lockOwner
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("lockOwner", lockOwner)
                .addValue("lastError", truncate(error))
                .addValue("now", Timestamp.from(now))
        ) > 0;
    }

    /** Puts a failed execution back on its queue for another attempt at {@code nextRunAt}. */
    public boolean reschedule(long taskId, String lockOwner, Instant nextRunAt, String error) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE stage_tasks
                SET state = 'QUEUED',
                    next_run_at = :nextRunAt,
                    last_error = :lastError,
                    attempts = attempts + 1,
                    locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND state = 'RUNNING'
                  AND lock_owner = :lockOwner
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("lockOwner", lockOwner)
                .addValue("nextRunAt", Timestamp.from(nextRunAt))
                .addValue("lastError", truncate(error))
                .addValue("now", Timestamp.from(now))
        ) > 0;
    }

    public boolean revoke(long taskId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE stage_tasks
                SET state = 'REVOKED',
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND state IN ('QUEUED', 'RUNNING')
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("now", Timestamp.from(now))
        ) > 0;
    }

    public StageTask findById(long taskId) {
        List<StageTask> results = jdbc.query(
            "SELECT " + COLUMNS + " FROM stage_tasks WHERE id = :id",
            new MapSqlParameterSource("id", taskId),
            taskMapper()
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public int countByState(String queueName, TaskState state) {
        Integer value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM stage_tasks
                WHERE queue_name = :queueName
                  AND state = :state
                """,
            new MapSqlParameterSource()
                .addValue("queueName", queueName)
                .addValue("state", state.name()),
            Integer.class
        );
        return value == null ? 0 : value;
    }

    private RowMapper<StageTask> taskMapper() {
        return (rs, rowNum) -> {
            long itemId = rs.getLong("item_id");
            Long boxedItemId = rs.wasNull() ? null : itemId;
            return new StageTask(
                rs.getLong("id"),
                rs.getString("task_name"),
                rs.getString("queue_name"),
                rs.getLong("search_id"),
                boxedItemId,
                rs.getString("payload"),
                TaskState.valueOf(rs.getString("state")),
                rs.getInt("attempts"),
                toInstant(rs.getTimestamp("next_run_at")),
                rs.getString("lock_owner"),
                rs.getString("result_json"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("finished_at"))
            );
        };
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
