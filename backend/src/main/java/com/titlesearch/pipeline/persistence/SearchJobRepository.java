package com.titlesearch.pipeline.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.pipeline.model.DiagnosticEntry;
import com.titlesearch.pipeline.model.PropertyTarget;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Search job rows. Every status or progress write is guarded against terminal rows, so a stage that
 * finishes after its job was cancelled changes nothing.
 */
@Repository
public class SearchJobRepository {
    private static final Logger log = LoggerFactory.getLogger(SearchJobRepository.class);
    private static final TypeReference<List<DiagnosticEntry>> ENTRY_LIST = new TypeReference<>() {};
    private static final int MAX_MESSAGE_LENGTH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public SearchJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertProperty(
        String streetAddress,
        String city,
        String county,
        String state,
        String zipCode,
        String parcelNumber
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("streetAddress", streetAddress)
            .addValue("city", city)
            .addValue("county", county)
            .addValue("state", state == null || state.isBlank() ? "CO" : state)
            .addValue("zipCode", zipCode)
            .addValue("parcelNumber", parcelNumber)
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO properties (
                    street_address, city, county, state, zip_code, parcel_number, created_at
                )
                VALUES (
                    :streetAddress, :city, :county, :state, :zipCode, :parcelNumber, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public PropertyTarget findProperty(long propertyId) {
        List<PropertyTarget> results = jdbc.query(
            """
                SELECT id, street_address, city, county, state, zip_code, parcel_number
                FROM properties
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", propertyId),
            (rs, rowNum) -> new PropertyTarget(
                rs.getLong("id"),
                rs.getString("street_address"),
                rs.getString("city"),
                rs.getString("county"),
                rs.getString("state"),
                rs.getString("zip_code"),
                rs.getString("parcel_number")
            )
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public long insertSearch(long propertyId, SearchPriority priority, int searchYears) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("propertyId", propertyId)
            .addValue("priority", priority.name())
            .addValue("searchYears", searchYears)
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO search_jobs (
                    property_id, status, status_message, progress_percent, priority,
                    retry_count, error_log, search_years, created_at, updated_at
                )
                VALUES (
                    :propertyId, 'PENDING', 'Search created', 0, :priority,
                    0, '[]', :searchYears, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        long id = key == null ? 0L : key.longValue();
        String reference = String.format("TS-%d-%05d", now.atZone(ZoneOffset.UTC).getYear(), id);
        jdbc.update(
            "UPDATE search_jobs SET reference_number = :reference WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("reference", reference)
                .addValue("id", id)
        );
        return id;
    }

    public SearchJob findById(long searchId) {
        List<SearchJob> results = jdbc.query(
            """
                SELECT id, reference_number, property_id, status, status_message, progress_percent,
                       priority, retry_count, error_log, external_task_handle, search_years,
                       created_at, started_at, completed_at
                FROM search_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", searchId),
            searchJobMapper()
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public SearchStatus findStatus(long searchId) {
        List<String> results = jdbc.query(
            "SELECT status FROM search_jobs WHERE id = :id",
            new MapSqlParameterSource("id", searchId),
            (rs, rowNum) -> rs.getString("status")
        );
        return results.isEmpty() ? null : SearchStatus.valueOf(results.get(0));
    }

    /** Moves a pending job into the queue for a new run. */
    public boolean markQueued(long searchId, String message) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'QUEUED',
                    status_message = :message,
                    started_at = :now,
                    completed_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('PENDING', 'QUEUED')
                """,
            params
        ) > 0;
    }

    public void updateExternalHandle(long searchId, String handle) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("handle", handle)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET external_task_handle = :handle,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Applies a stage boundary update. {@code status} may be null to keep the current one; progress
     * only ever moves forward.
     */
    public boolean updateProgress(long searchId, SearchStatus status, int progressPercent, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("status", status == null ? null : status.name(), Types.VARCHAR)
            .addValue("progress", Math.min(100, Math.max(0, progressPercent)))
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = COALESCE(:status, status),
                    progress_percent = GREATEST(progress_percent, :progress),
                    status_message = :message,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
                """,
            params
        ) > 0;
    }

    public boolean markCompleted(long searchId, String message) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'COMPLETED',
                    status_message = :message,
                    progress_percent = 100,
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
                """,
            params
        ) > 0;
    }

    public boolean markFailed(long searchId, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'FAILED',
                    status_message = :message,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
                """,
            params
        ) > 0;
    }

    public boolean markCancelled(long searchId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'CANCELLED',
                    status_message = 'Search cancelled by user',
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('COMPLETED', 'CANCELLED')
                """,
            params
        ) > 0;
    }

    /** Starts a new run of a failed job: progress restarts at zero and the resumption counter grows. */
    public boolean resetForRetry(long searchId, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'PENDING',
                    status_message = :message,
                    progress_percent = 0,
                    retry_count = retry_count + 1,
                    completed_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'FAILED'
                """,
            params
        ) > 0;
    }

    public boolean acceptPartialResults(long searchId, String message) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", searchId)
            .addValue("message", truncate(message))
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE search_jobs
                SET status = 'COMPLETED',
                    status_message = :message,
                    progress_percent = 100,
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'FAILED'
                """,
            params
        ) > 0;
    }

    /**
     * Appends one entry to the job's error log under a row lock so concurrent appends keep their
     * order and never overwrite each other.
     */
    @Transactional
    public void appendDiagnostic(long searchId, DiagnosticEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", searchId);
        List<String> current = jdbc.query(
            "SELECT error_log FROM search_jobs WHERE id = :id FOR UPDATE",
            params,
            (rs, rowNum) -> rs.getString("error_log")
        );
        if (current.isEmpty()) {
            log.warn("Cannot append diagnostic, search {} not found", searchId);
            return;
        }
        List<DiagnosticEntry> entries = new ArrayList<>(readErrorLog(searchId, current.get(0)));
        entries.add(entry);
        String json;
        try {
            json = objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error log for search " + searchId, e);
        }
        jdbc.update(
            "UPDATE search_jobs SET error_log = :errorLog, updated_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", searchId)
                .addValue("errorLog", json)
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    public List<Long> findInFlightStartedBefore(Instant cutoff) {
        return jdbc.query(
            """
                SELECT id
                FROM search_jobs
                WHERE status IN ('QUEUED', 'SCRAPING', 'ANALYZING', 'GENERATING')
                  AND started_at < :cutoff
                ORDER BY started_at ASC
                """,
            new MapSqlParameterSource("cutoff", Timestamp.from(cutoff)),
            (rs, rowNum) -> rs.getLong("id")
        );
    }

    private RowMapper<SearchJob> searchJobMapper() {
        return (rs, rowNum) -> {
            long id = rs.getLong("id");
            return new SearchJob(
                id,
                rs.getString("reference_number"),
                rs.getLong("property_id"),
                SearchStatus.valueOf(rs.getString("status")),
                rs.getString("status_message"),
                rs.getInt("progress_percent"),
                SearchPriority.parse(rs.getString("priority")),
                rs.getInt("retry_count"),
                readErrorLog(id, rs.getString("error_log")),
                rs.getString("external_task_handle"),
                rs.getInt("search_years"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at"))
            );
        };
    }

    private List<DiagnosticEntry> readErrorLog(long searchId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<DiagnosticEntry> entries = objectMapper.readValue(json, ENTRY_LIST);
            return entries == null ? List.of() : List.copyOf(entries);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable error log for search {}", searchId, e);
            return List.of();
        }
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
