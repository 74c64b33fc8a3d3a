package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.adapter.AdapterRegistry;
import com.titlesearch.pipeline.adapter.RecorderAdapter;
import com.titlesearch.pipeline.adapter.RecorderUnavailableException;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.model.CountyConfig;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DownloadedDocument;
import com.titlesearch.pipeline.model.PropertyTarget;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.CountyConfigRepository;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.SearchJobRepository;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Component
public class DownloadDocumentTask implements StageTaskHandler {
    private final SearchJobRepository searchJobs;
    private final CountyConfigRepository counties;
    private final DocumentRepository documents;
    private final AdapterRegistry adapters;
    private final BrowserPool browserPool;
    private final PipelineProperties properties;

    public DownloadDocumentTask(
        SearchJobRepository searchJobs,
        CountyConfigRepository counties,
        DocumentRepository documents,
        AdapterRegistry adapters,
        BrowserPool browserPool,
        PipelineProperties properties
    ) {
        this.searchJobs = searchJobs;
        this.counties = counties;
        this.documents = documents;
        this.adapters = adapters;
        this.browserPool = browserPool;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.DOWNLOAD_DOCUMENT;
    }

    @Override
    public int maxRetries() {
        return properties.getRetry().getDownloadMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) throws IOException {
        DocumentRecord document = task.itemId() == null ? null : documents.findById(task.itemId());
        if (document == null) {
            throw new IllegalArgumentException("Invalid download task: document " + task.itemId() + " not found");
        }
        if (document.isDownloaded()) {
            return StageOutcome.success(1, 1, 0, "Already downloaded");
        }
        SearchJob job = searchJobs.findById(task.searchId());
        if (job == null || job.status().isTerminal()) {
            return StageOutcome.skipped("Search " + task.searchId() + " is no longer active");
        }
        PropertyTarget property = searchJobs.findProperty(job.propertyId());
        CountyConfig county = property == null ? null : counties.findByName(property.county(), property.state());
        if (county == null) {
            throw new RecorderUnavailableException("Recorder website unavailable: county is not configured");
        }
        RecorderAdapter adapter = document.source() == DocumentSource.COURT_RECORDS
            ? adapters.courtFor(county)
            : adapters.recorderFor(county);
        String affinityKey = document.source() == DocumentSource.COURT_RECORDS
            ? AdapterRegistry.COURT_RECORDS
            : ScrapeCountyRecordsTask.affinityKey(county);

        Path directory = Paths.get(properties.getStoragePath(), "searches", String.valueOf(job.id()));
        Files.createDirectories(directory);
        SearchResult target = toSearchResult(document);
        DownloadedDocument downloaded = browserPool.withSession(affinityKey, session -> {
            try {
                return adapter.downloadDocument(session, target, directory);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        if (downloaded == null) {
            throw new DocumentDownloadException(
                "No document content available for instrument " + document.instrumentNumber()
            );
        }
        documents.markDownloaded(document.id(), downloaded);
        return StageOutcome.success(1, 1, 0, "Downloaded " + document.instrumentNumber());
    }

    static SearchResult toSearchResult(DocumentRecord document) {
        return new SearchResult(
            document.instrumentNumber(),
            document.documentType(),
            document.recordingDate(),
            splitNames(document.grantor()),
            splitNames(document.grantee()),
            document.sourceUrl(),
            document.bookPage(),
            Map.of()
        );
    }

    private static List<String> splitNames(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(";"))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }
}
