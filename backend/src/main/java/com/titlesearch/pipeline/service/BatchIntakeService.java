package com.titlesearch.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.BatchDetail;
import com.titlesearch.pipeline.model.BatchItem;
import com.titlesearch.pipeline.model.BatchStatus;
import com.titlesearch.pipeline.model.BatchUpload;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatusView;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.BatchRepository;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.StageTaskQueue;
import com.titlesearch.pipeline.queue.TaskNames;
import com.titlesearch.pipeline.recovery.ErrorClassifier;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Year;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Bulk intake of searches from a CSV upload. Rows are stored as they arrive; searches are only
 * created once the batch is processed, each starting a little after the previous one.
 */
@Service
public class BatchIntakeService {
    private static final Logger log = LoggerFactory.getLogger(BatchIntakeService.class);

    static final String MISSING_FIELDS = "Missing required fields (street_address, city, county)";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setIgnoreHeaderCase(true)
        .setAllowMissingColumnNames(true)
        .setTrim(true)
        .build();

    private final BatchRepository batches;
    private final SearchJobService searchJobService;
    private final StageTaskQueue queue;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public BatchIntakeService(
        BatchRepository batches,
        SearchJobService searchJobService,
        StageTaskQueue queue,
        ObjectMapper objectMapper,
        PipelineProperties properties
    ) {
        this.batches = batches;
        this.searchJobService = searchJobService;
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Stores every data row of {@code csv} as a pending batch item.
     *
     * @throws IllegalArgumentException when the file is not a CSV, is unreadable, has no data rows or
     *     has more rows than allowed
     */
    @Transactional
    public BatchUpload upload(String filename, Reader csv) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new IllegalArgumentException("Only CSV files are supported");
        }
        int maxRows = properties.getBatch().getMaxRows();
        long batchId = batches.insertBatch(newBatchNumber(), filename);
        int rows = 0;
        try (CSVParser parser = FORMAT.parse(csv)) {
            for (CSVRecord record : parser) {
                if (rows == maxRows) {
                    throw new IllegalArgumentException("CSV file has more than " + maxRows + " rows");
                }
                rows++;
                batches.insertItem(
                    batchId,
                    rows,
                    toJson(record),
                    value(record, "street_address", "address"),
                    value(record, "city"),
                    value(record, "county"),
                    value(record, "state"),
                    value(record, "zip_code", "zip"),
                    value(record, "parcel_number", "parcel", "apn")
                );
            }
        } catch (IOException | UncheckedIOException e) {
            throw new IllegalArgumentException("Unreadable CSV file: " + e.getMessage(), e);
        }
        if (rows == 0) {
            throw new IllegalArgumentException("CSV file is empty");
        }
        batches.updateTotal(batchId, rows);
        BatchUpload batch = batches.findById(batchId);
        log.info("Batch {} uploaded from {} with {} rows", batch.batchNumber(), filename, rows);
        return batch;
    }

    /** Moves a pending batch to PROCESSING and queues the task that works through its rows. */
    @Transactional
    public BatchUpload startProcessing(long batchId) {
        BatchUpload batch = requireBatch(batchId);
        if (!batches.markProcessing(batchId)) {
            throw new InvalidBatchStateException(
                "Batch " + batch.batchNumber() + " is " + batch.status() + ", only pending batches can be processed"
            );
        }
        queue.submit(TaskNames.PROCESS_BATCH, 0L, batchId, null, QueueNames.DEFAULT, Duration.ZERO);
        log.info("Batch {} queued for processing", batch.batchNumber());
        return batches.findById(batchId);
    }

    /**
     * Creates a search for every pending row. Runs outside a transaction so each search commits on its
     * own and a bad row only fails itself. Stops early once the batch is cancelled.
     */
    public StageOutcome process(long batchId) {
        BatchUpload batch = batches.findById(batchId);
        if (batch == null) {
            throw new IllegalArgumentException("Invalid batch task: batch " + batchId + " not found");
        }
        if (batch.status() != BatchStatus.PROCESSING) {
            log.info("Batch {} is {}, not processing", batch.batchNumber(), batch.status());
            return StageOutcome.skipped("Batch " + batch.batchNumber() + " is " + batch.status());
        }
        int processed = batch.processedRecords();
        int successful = batch.successfulRecords();
        int failed = batch.failedRecords();
        long staggerSeconds = properties.getBatch().getStaggerSeconds();
        for (BatchItem item : batches.findPendingItems(batchId)) {
            if (isCancelled(batchId)) {
                log.info("Batch {} cancelled after {} rows", batch.batchNumber(), processed);
                break;
            }
            if (createSearch(batch, item, Duration.ofSeconds(processed * staggerSeconds))) {
                successful++;
            } else {
                failed++;
            }
            processed++;
            batches.updateCounts(batchId, processed, successful, failed);
        }
        batches.markFinished(batchId, BatchStatus.COMPLETED, null);
        log.info(
            "Batch {} finished: {} processed, {} searches created, {} failed",
            batch.batchNumber(),
            processed,
            successful,
            failed
        );
        return StageOutcome.success(
            processed,
            successful,
            failed,
            "Processed " + processed + " rows: " + successful + " searches created, " + failed + " failed"
        );
    }

    public void markFailed(long batchId, String error) {
        if (batches.markFinished(batchId, BatchStatus.FAILED, error)) {
            log.warn("Batch {} failed: {}", batchId, error);
        }
    }

    @Transactional
    public BatchUpload cancel(long batchId) {
        BatchUpload batch = requireBatch(batchId);
        if (!batches.markCancelled(batchId)) {
            throw new InvalidBatchStateException("Cannot cancel completed or already cancelled batch");
        }
        log.info("Batch {} cancelled; searches already created keep running", batch.batchNumber());
        return batches.findById(batchId);
    }

    public BatchDetail detail(long batchId) {
        return new BatchDetail(requireBatch(batchId), batches.findItems(batchId));
    }

    public List<BatchUpload> recent() {
        return batches.findRecent(properties.getBatch().getListLimit());
    }

    private boolean createSearch(BatchUpload batch, BatchItem item, Duration startDelay) {
        if (isBlank(item.streetAddress()) || isBlank(item.city()) || isBlank(item.county())) {
            batches.markItemFailed(item.id(), MISSING_FIELDS);
            return false;
        }
        try {
            SearchStatusView search = searchJobService.create(
                item.streetAddress(),
                item.city(),
                item.county(),
                item.state(),
                item.zipCode(),
                item.parcelNumber(),
                SearchPriority.NORMAL,
                null,
                startDelay
            );
            batches.markItemCompleted(item.id(), search.id());
            return true;
        } catch (IllegalArgumentException | DataAccessException e) {
            String error = ErrorClassifier.describe(e);
            log.warn("Batch {} row {} rejected: {}", batch.batchNumber(), item.lineNumber(), error);
            batches.markItemFailed(item.id(), error);
            return false;
        }
    }

    private boolean isCancelled(long batchId) {
        BatchUpload current = batches.findById(batchId);
        return current == null || current.status() == BatchStatus.CANCELLED;
    }

    private BatchUpload requireBatch(long batchId) {
        BatchUpload batch = batches.findById(batchId);
        if (batch == null) {
            throw new BatchNotFoundException(batchId);
        }
        return batch;
    }

    private String toJson(CSVRecord record) {
        try {
            return objectMapper.writeValueAsString(record.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize CSV row " + record.getRecordNumber(), e);
        }
    }

    private static String value(CSVRecord record, String... names) {
        for (String name : names) {
            if (record.isSet(name)) {
                String value = record.get(name);
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String newBatchNumber() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "BATCH-" + Year.now().getValue() + "-" + suffix;
    }
}
