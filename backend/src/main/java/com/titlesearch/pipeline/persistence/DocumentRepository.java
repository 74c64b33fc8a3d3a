package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.DownloadedDocument;
import com.titlesearch.pipeline.model.SearchResult;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Repository
public class DocumentRepository {
    private static final String COLUMNS = """
        id, search_id, document_type, source, instrument_number, book_page, recording_date,
        grantor, grantee, source_url, file_path, file_size, content_hash, analysis_summary,
        needs_review, analyzed_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public DocumentRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertDocument(long searchId, SearchResult result, DocumentSource source) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("searchId", searchId)
            .addValue("documentType", result.documentType() == null ? DocumentType.OTHER.name() : result.documentType().name())
            .addValue("source", source.name())
            .addValue("instrumentNumber", result.instrumentNumber())
            .addValue("bookPage", result.bookPage())
            .addValue("recordingDate", toDate(result.recordingDate()))
            .addValue("grantor", joinNames(result.grantor()))
            .addValue("grantee", joinNames(result.grantee()))
            .addValue("sourceUrl", result.downloadUrl())
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO documents (
                    search_id, document_type, source, instrument_number, book_page, recording_date,
                    grantor, grantee, source_url, needs_review, created_at
                )
                VALUES (
                    :searchId, :documentType, :source, :instrumentNumber, :bookPage, :recordingDate,
                    :grantor, :grantee, :sourceUrl, FALSE, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public boolean existsInstrument(long searchId, String instrumentNumber, DocumentSource source) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM documents
                WHERE search_id = :searchId
                  AND instrument_number = :instrumentNumber
                  AND source = :source
                """,
            new MapSqlParameterSource()
                .addValue("searchId", searchId)
                .addValue("instrumentNumber", instrumentNumber)
                .addValue("source", source.name()),
            Integer.class
        );
        return count != null && count > 0;
    }

    public DocumentRecord findById(long documentId) {
        List<DocumentRecord> results = jdbc.query(
            "SELECT " + COLUMNS + " FROM documents WHERE id = :id",
            new MapSqlParameterSource("id", documentId),
            documentMapper()
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<DocumentRecord> findBySearch(long searchId) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM documents WHERE search_id = :searchId ORDER BY recording_date ASC NULLS LAST, id ASC",
            new MapSqlParameterSource("searchId", searchId),
            documentMapper()
        );
    }

    public List<DocumentRecord> findPendingDownload(long searchId) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM documents
                WHERE search_id = :searchId
                  AND source_url IS NOT NULL
                  AND file_path IS NULL
                ORDER BY id ASC
                """,
            new MapSqlParameterSource("searchId", searchId),
            documentMapper()
        );
    }

    public List<DocumentRecord> findPendingAnalysis(long searchId) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM documents
                WHERE search_id = :searchId
                  AND analyzed_at IS NULL
                ORDER BY id ASC
                """,
            new MapSqlParameterSource("searchId", searchId),
            documentMapper()
        );
    }

    public int countBySearch(long searchId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM documents WHERE search_id = :searchId",
            new MapSqlParameterSource("searchId", searchId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public int countNeedingReview(long searchId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM documents WHERE search_id = :searchId AND needs_review = TRUE",
            new MapSqlParameterSource("searchId", searchId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void markDownloaded(long documentId, DownloadedDocument downloaded) {
        jdbc.update(
            """
                UPDATE documents
                SET file_path = :filePath,
                    file_size = :fileSize,
                    content_hash = :contentHash
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", documentId)
                .addValue("filePath", downloaded.filePath())
                .addValue("fileSize", downloaded.fileSize())
                .addValue("contentHash", downloaded.contentHash())
        );
    }

    public void markAnalyzed(long documentId, DocumentType documentType, String summary, boolean needsReview) {
        jdbc.update(
            """
                UPDATE documents
                SET document_type = :documentType,
                    analysis_summary = :summary,
                    needs_review = :needsReview,
                    analyzed_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", documentId)
                .addValue("documentType", documentType.name())
                .addValue("summary", summary)
                .addValue("needsReview", needsReview)
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    private RowMapper<DocumentRecord> documentMapper() {
        return (rs, rowNum) -> {
            long fileSize = rs.getLong("file_size");
            Long boxedSize = rs.wasNull() ? null : fileSize;
            Date recordingDate = rs.getDate("recording_date");
            Timestamp analyzedAt = rs.getTimestamp("analyzed_at");
            return new DocumentRecord(
                rs.getLong("id"),
                rs.getLong("search_id"),
                DocumentType.parse(rs.getString("document_type")),
                DocumentSource.valueOf(rs.getString("source")),
                rs.getString("instrument_number"),
                rs.getString("book_page"),
                recordingDate == null ? null : recordingDate.toLocalDate(),
                rs.getString("grantor"),
                rs.getString("grantee"),
                rs.getString("source_url"),
                rs.getString("file_path"),
                boxedSize,
                rs.getString("content_hash"),
                rs.getString("analysis_summary"),
                rs.getBoolean("needs_review"),
                analyzedAt == null ? null : analyzedAt.toInstant()
            );
        };
    }

    private static Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private static String joinNames(List<String> names) {
        return names == null || names.isEmpty() ? null : String.join("; ", names);
    }
}
