package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.ChainOfTitleEntry;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.EncumbranceRecord;
import com.titlesearch.pipeline.model.EncumbranceType;
import com.titlesearch.pipeline.model.TitleReportSummary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Rows derived from a search's documents: chain of title, encumbrances and the report summary.
 * Each writer replaces its own rows, so re-running a stage after a retry is idempotent.
 */
@Repository
public class TitleRecordRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public TitleRecordRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Transactional
    public void replaceChain(long searchId, List<ChainOfTitleEntry> entries) {
        jdbc.update(
            "DELETE FROM chain_of_title_entries WHERE search_id = :searchId",
            new MapSqlParameterSource("searchId", searchId)
        );
        if (entries.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(Instant.now());
        MapSqlParameterSource[] batch = entries.stream()
            .map(entry -> new MapSqlParameterSource()
                .addValue("searchId", searchId)
                .addValue("documentId", entry.documentId())
                .addValue("sequenceNumber", entry.sequenceNumber())
                .addValue("grantor", entry.grantor())
                .addValue("grantee", entry.grantee())
                .addValue("transferDate", toDate(entry.transferDate()))
                .addValue("instrumentNumber", entry.instrumentNumber())
                .addValue("documentType", entry.documentType() == null ? null : entry.documentType().name())
                .addValue("now", now))
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO chain_of_title_entries (
                    search_id, document_id, sequence_number, grantor, grantee,
                    transfer_date, instrument_number, document_type, created_at
                )
                VALUES (
                    :searchId, :documentId, :sequenceNumber, :grantor, :grantee,
                    :transferDate, :instrumentNumber, :documentType, :now
                )
                """,
            batch
        );
    }

    public List<ChainOfTitleEntry> findChain(long searchId) {
        return jdbc.query(
            """
                SELECT id, search_id, document_id, sequence_number, grantor, grantee,
                       transfer_date, instrument_number, document_type
                FROM chain_of_title_entries
                WHERE search_id = :searchId
                ORDER BY sequence_number ASC
                """,
            new MapSqlParameterSource("searchId", searchId),
            (rs, rowNum) -> {
                long documentId = rs.getLong("document_id");
                Long boxedDocumentId = rs.wasNull() ? null : documentId;
                Date transferDate = rs.getDate("transfer_date");
                return new ChainOfTitleEntry(
                    rs.getLong("id"),
                    rs.getLong("search_id"),
                    boxedDocumentId,
                    rs.getInt("sequence_number"),
                    rs.getString("grantor"),
                    rs.getString("grantee"),
                    transferDate == null ? null : transferDate.toLocalDate(),
                    rs.getString("instrument_number"),
                    DocumentType.parse(rs.getString("document_type"))
                );
            }
        );
    }

    @Transactional
    public void replaceEncumbrances(long searchId, List<EncumbranceRecord> encumbrances) {
        jdbc.update(
            "DELETE FROM encumbrances WHERE search_id = :searchId",
            new MapSqlParameterSource("searchId", searchId)
        );
        if (encumbrances.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(Instant.now());
        MapSqlParameterSource[] batch = encumbrances.stream()
            .map(encumbrance -> new MapSqlParameterSource()
                .addValue("searchId", searchId)
                .addValue("documentId", encumbrance.documentId())
                .addValue("type", encumbrance.encumbranceType().name())
                .addValue("status", encumbrance.status())
                .addValue("holder", encumbrance.holder())
                .addValue("recordingDate", toDate(encumbrance.recordingDate()))
                .addValue("description", encumbrance.description())
                .addValue("now", now))
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO encumbrances (
                    search_id, document_id, encumbrance_type, status, holder,
                    recording_date, description, created_at
                )
                VALUES (
                    :searchId, :documentId, :type, :status, :holder,
                    :recordingDate, :description, :now
                )
                """,
            batch
        );
    }

    public List<EncumbranceRecord> findEncumbrances(long searchId) {
        return jdbc.query(
            """
                SELECT id, search_id, document_id, encumbrance_type, status, holder,
                       recording_date, description
                FROM encumbrances
                WHERE search_id = :searchId
                ORDER BY recording_date ASC NULLS LAST, id ASC
                """,
            new MapSqlParameterSource("searchId", searchId),
            (rs, rowNum) -> {
                long documentId = rs.getLong("document_id");
                Long boxedDocumentId = rs.wasNull() ? null : documentId;
                Date recordingDate = rs.getDate("recording_date");
                return new EncumbranceRecord(
                    rs.getLong("id"),
                    rs.getLong("search_id"),
                    boxedDocumentId,
                    EncumbranceType.valueOf(rs.getString("encumbrance_type")),
                    rs.getString("status"),
                    rs.getString("holder"),
                    recordingDate == null ? null : recordingDate.toLocalDate(),
                    rs.getString("description")
                );
            }
        );
    }

    @Transactional
    public void saveReport(long searchId, String reportNumber, int riskScore, String riskLevel, String summary) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("searchId", searchId)
            .addValue("reportNumber", reportNumber)
            .addValue("riskScore", riskScore)
            .addValue("riskLevel", riskLevel)
            .addValue("summary", summary)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update("DELETE FROM title_reports WHERE search_id = :searchId", params);
        jdbc.update(
            """
                INSERT INTO title_reports (
                    search_id, report_number, risk_score, risk_level, summary, generated_at
                )
                VALUES (
                    :searchId, :reportNumber, :riskScore, :riskLevel, :summary, :now
                )
                """,
            params
        );
    }

    public TitleReportSummary findReport(long searchId) {
        List<TitleReportSummary> results = jdbc.query(
            """
                SELECT id, search_id, report_number, risk_score, risk_level, summary, generated_at
                FROM title_reports
                WHERE search_id = :searchId
                """,
            new MapSqlParameterSource("searchId", searchId),
            (rs, rowNum) -> new TitleReportSummary(
                rs.getLong("id"),
                rs.getLong("search_id"),
                rs.getString("report_number"),
                rs.getInt("risk_score"),
                rs.getString("risk_level"),
                rs.getString("summary"),
                rs.getTimestamp("generated_at").toInstant()
            )
        );
        return results.isEmpty() ? null : results.get(0);
    }

    private static Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }
}
