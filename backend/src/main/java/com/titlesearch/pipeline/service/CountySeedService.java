package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads county recorder configuration from a CSV resource on startup. Existing counties are left
 * untouched so operator edits survive restarts.
 */
@Component
public class CountySeedService implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CountySeedService.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    private final CountyConfigRepository counties;
    private final ResourceLoader resourceLoader;
    private final PipelineProperties properties;

    public CountySeedService(
        CountyConfigRepository counties,
        ResourceLoader resourceLoader,
        PipelineProperties properties
    ) {
        this.counties = counties;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isEnabled()) {
            return;
        }
        String location = properties.getSeed().getCountiesCsv();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("County seed file {} not found, skipping", location);
            return;
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            int inserted = seed(reader);
            log.info("County seed from {} inserted {} new counties", location, inserted);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read county seed " + location, e);
        }
    }

    int seed(Reader reader) throws IOException {
        int inserted = 0;
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String countyName = record.get("county_name");
                if (countyName == null || countyName.isBlank()) {
                    continue;
                }
                boolean created = counties.insertIfMissing(
                    countyName,
                    blankToNull(record.get("state")),
                    blankToNull(record.get("fips_code")),
                    blankToNull(record.get("recorder_url")),
                    blankToNull(record.get("court_records_url")),
                    blankToNull(record.get("scraping_adapter")),
                    parseInt(record.get("requests_per_minute"), 10),
                    parseInt(record.get("delay_between_requests_ms"), 2000)
                );
                if (created) {
                    inserted++;
                }
            }
        }
        return inserted;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer '{}' in county seed, using {}", value, fallback);
            return fallback;
        }
    }
}
