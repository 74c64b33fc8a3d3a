package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.BatchItem;
import com.titlesearch.pipeline.model.BatchItemStatus;
import com.titlesearch.pipeline.model.BatchStatus;
import com.titlesearch.pipeline.model.BatchUpload;
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
 * Batch uploads and their rows. Status moves are conditional on the current status so a cancel that
 * races the processing task wins cleanly.
 */
@Repository
public class BatchRepository {
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final String ITEM_COLUMNS = """
        SELECT id, batch_id, line_number, street_address, city, county, state, zip_code,
               parcel_number, search_id, status, error_message, processed_at
        FROM batch_items
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public BatchRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertBatch(String batchNumber, String originalFilename) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("batchNumber", batchNumber)
            .addValue("filename", originalFilename)
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO batch_uploads (batch_number, original_filename, status, created_at)
                VALUES (:batchNumber, :filename, 'PENDING', :now)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public void insertItem(
        long batchId,
        int lineNumber,
        String rawInput,
        String streetAddress,
        String city,
        String county,
        String state,
        String zipCode,
        String parcelNumber
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("batchId", batchId)
            .addValue("lineNumber", lineNumber)
            .addValue("rawInput", rawInput)
            .addValue("streetAddress", streetAddress)
            .addValue("city", city)
            .addValue("county", county)
            .addValue("state", state)
            .addValue("zipCode", zipCode)
            .addValue("parcelNumber", parcelNumber);
        jdbc.update(
            """
                INSERT INTO batch_items (
                    batch_id, line_number, raw_input, street_address, city, county, state, zip_code,
                    parcel_number, status
                )
                VALUES (
                    :batchId, :lineNumber, :rawInput, :streetAddress, :city, :county, :state, :zipCode,
                    :parcelNumber, 'PENDING'
                )
                """,
            params
        );
    }

    public void updateTotal(long batchId, int totalRecords) {
        jdbc.update(
            "UPDATE batch_uploads SET total_records = :total WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("total", totalRecords)
        );
    }

    public BatchUpload findById(long batchId) {
        List<BatchUpload> results = jdbc.query(
            """
                SELECT id, batch_number, original_filename, status, total_records, processed_records,
                       successful_records, failed_records, error_message, created_at, started_at,
                       completed_at
                FROM batch_uploads
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", batchId),
            batchMapper()
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<BatchUpload> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT id, batch_number, original_filename, status, total_records, processed_records,
                       successful_records, failed_records, error_message, created_at, started_at,
                       completed_at
                FROM batch_uploads
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", limit),
            batchMapper()
        );
    }

    public List<BatchItem> findItems(long batchId) {
        return jdbc.query(
            ITEM_COLUMNS + " WHERE batch_id = :batchId ORDER BY line_number ASC",
            new MapSqlParameterSource("batchId", batchId),
            itemMapper()
        );
    }

    public List<BatchItem> findPendingItems(long batchId) {
        return jdbc.query(
            ITEM_COLUMNS + " WHERE batch_id = :batchId AND status = 'PENDING' ORDER BY line_number ASC",
            new MapSqlParameterSource("batchId", batchId),
            itemMapper()
        );
    }

    /** Claims a pending batch for processing. */
    public boolean markProcessing(long batchId) {
        return jdbc.update(
            """
                UPDATE batch_uploads
                SET status = 'PROCESSING',
                    started_at = :now
                WHERE id = :id
                  AND status = 'PENDING'
                """,
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("now", Timestamp.from(Instant.now()))
        ) > 0;
    }

    public void updateCounts(long batchId, int processed, int successful, int failed) {
        jdbc.update(
            """
                UPDATE batch_uploads
                SET processed_records = :processed,
                    successful_records = :successful,
                    failed_records = :failed
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("processed", processed)
                .addValue("successful", successful)
                .addValue("failed", failed)
        );
    }

    /** Closes a batch that is still processing; a cancelled batch keeps its status. */
    public boolean markFinished(long batchId, BatchStatus status, String errorMessage) {
        return jdbc.update(
            """
                UPDATE batch_uploads
                SET status = :status,
                    error_message = :error,
                    completed_at = :now
                WHERE id = :id
                  AND status = 'PROCESSING'
                """,
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("status", status.name())
                .addValue("error", truncate(errorMessage))
                .addValue("now", Timestamp.from(Instant.now()))
        ) > 0;
    }

    public boolean markCancelled(long batchId) {
        return jdbc.update(
            """
                UPDATE batch_uploads
                SET status = 'CANCELLED',
                    completed_at = :now
                WHERE id = :id
                  AND status IN ('PENDING', 'PROCESSING')
                """,
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("now", Timestamp.from(Instant.now()))
        ) > 0;
    }

    public void markItemCompleted(long itemId, long searchId) {
        jdbc.update(
            """
                UPDATE batch_items
                SET status = 'COMPLETED',
                    search_id = :searchId,
                    processed_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", itemId)
                .addValue("searchId", searchId)
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    public void markItemFailed(long itemId, String error) {
        jdbc.update(
            """
                UPDATE batch_items
                SET status = 'FAILED',
                    error_message = :error,
                    processed_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", itemId)
                .addValue("error", truncate(error))
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    private RowMapper<BatchUpload> batchMapper() {
        return (rs, rowNum) -> new BatchUpload(
            rs.getLong("id"),
            rs.getString("batch_number"),
            rs.getString("original_filename"),
            BatchStatus.valueOf(rs.getString("status")),
            rs.getInt("total_records"),
            rs.getInt("processed_records"),
            rs.getInt("successful_records"),
            rs.getInt("failed_records"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private RowMapper<BatchItem> itemMapper() {
        return (rs, rowNum) -> new BatchItem(
            rs.getLong("id"),
            rs.getLong("batch_id"),
            rs.getInt("line_number"),
            rs.getString("street_address"),
            rs.getString("city"),
            rs.getString("county"),
            rs.getString("state"),
            rs.getString("zip_code"),
            rs.getString("parcel_number"),
            rs.getObject("search_id", Long.class),
            BatchItemStatus.valueOf(rs.getString("status")),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("processed_at"))
        );
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
