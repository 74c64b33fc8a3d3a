package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.CountyConfig;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class CountyConfigRepository {
    private static final String COLUMNS = """
        id, county_name, state, recorder_url, court_records_url, scraping_adapter,
        requests_per_minute, delay_between_requests_ms, scraping_enabled, is_healthy,
        consecutive_failures, last_successful_scrape, last_failed_scrape
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CountyConfigRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public CountyConfig findByName(String countyName, String state) {
        List<CountyConfig> results = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM county_configs
                WHERE LOWER(county_name) = LOWER(:countyName)
                  AND state = :state
                """,
            new MapSqlParameterSource()
                .addValue("countyName", countyName == null ? "" : countyName.trim())
                .addValue("state", state == null || state.isBlank() ? "CO" : state.trim()),
            countyMapper()
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<CountyConfig> findAll() {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM county_configs ORDER BY county_name ASC",
            new MapSqlParameterSource(),
            countyMapper()
        );
    }

    public boolean insertIfMissing(
        String countyName,
        String state,
        String fipsCode,
        String recorderUrl,
        String courtRecordsUrl,
        String scrapingAdapter,
        int requestsPerMinute,
        int delayBetweenRequestsMs
    ) {
        String resolvedState = state == null || state.isBlank() ? "CO" : state;
        if (findByName(countyName, resolvedState) != null) {
            return false;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("countyName", countyName)
            .addValue("state", resolvedState)
            .addValue("fipsCode", fipsCode)
            .addValue("recorderUrl", recorderUrl)
            .addValue("courtRecordsUrl", courtRecordsUrl)
            .addValue("scrapingAdapter", scrapingAdapter == null || scrapingAdapter.isBlank() ? "generic" : scrapingAdapter)
            .addValue("requestsPerMinute", requestsPerMinute)
            .addValue("delayMs", delayBetweenRequestsMs)
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                INSERT INTO county_configs (
                    county_name, state, fips_code, recorder_url, court_records_url, scraping_adapter,
                    requests_per_minute, delay_between_requests_ms, updated_at
                )
                VALUES (
                    :countyName, :state, :fipsCode, :recorderUrl, :courtRecordsUrl, :scrapingAdapter,
                    :requestsPerMinute, :delayMs, :now
                )
                """,
            params
        ) > 0;
    }

    public void recordScrapeSuccess(long countyId) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE county_configs
                SET consecutive_failures = 0,
                    is_healthy = TRUE,
                    last_successful_scrape = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", countyId)
                .addValue("now", Timestamp.from(now))
        );
    }

    public void recordScrapeFailure(long countyId, int unhealthyThreshold) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE county_configs
                SET consecutive_failures = consecutive_failures + 1,
                    is_healthy = CASE
                        WHEN consecutive_failures + 1 >= :threshold THEN FALSE
                        ELSE is_healthy
                    END,
                    last_failed_scrape = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", countyId)
                .addValue("threshold", unhealthyThreshold)
                .addValue("now", Timestamp.from(now))
        );
    }

    public void markHealth(long countyId, boolean healthy) {
        jdbc.update(
            """
                UPDATE county_configs
                SET is_healthy = :healthy,
                    consecutive_failures = CASE WHEN :healthy THEN 0 ELSE consecutive_failures END,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", countyId)
                .addValue("healthy", healthy)
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    private RowMapper<CountyConfig> countyMapper() {
        return (rs, rowNum) -> new CountyConfig(
            rs.getLong("id"),
            rs.getString("county_name"),
            rs.getString("state"),
            rs.getString("recorder_url"),
            rs.getString("court_records_url"),
            rs.getString("scraping_adapter"),
            rs.getInt("requests_per_minute"),
            rs.getInt("delay_between_requests_ms"),
            rs.getBoolean("scraping_enabled"),
            rs.getBoolean("is_healthy"),
            rs.getInt("consecutive_failures"),
            toInstant(rs.getTimestamp("last_successful_scrape")),
            toInstant(rs.getTimestamp("last_failed_scrape"))
        );
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
