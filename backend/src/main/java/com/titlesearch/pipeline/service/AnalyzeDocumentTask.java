package com.titlesearch.pipeline.service;

import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.queue.StageTask;
import com.titlesearch.pipeline.queue.StageTaskHandler;
import com.titlesearch.pipeline.queue.TaskNames;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Analyzes one document through the analysis service, or summarizes it from its recorded index
 * data when no service is configured.
 */
@Component
public class AnalyzeDocumentTask implements StageTaskHandler {
    private final DocumentRepository documents;
    private final AnalysisServiceClient analysisClient;
    private final PipelineProperties properties;

    public AnalyzeDocumentTask(
        DocumentRepository documents,
        AnalysisServiceClient analysisClient,
        PipelineProperties properties
    ) {
        this.documents = documents;
        this.analysisClient = analysisClient;
        this.properties = properties;
    }

    @Override
    public String taskName() {
        return TaskNames.ANALYZE_DOCUMENT;
    }

    @Override
    public int maxRetries() {
        return properties.getRetry().getAnalyzeMaxRetries();
    }

    @Override
    public StageOutcome handle(StageTask task) {
        DocumentRecord document = task.itemId() == null ? null : documents.findById(task.itemId());
        if (document == null) {
            throw new IllegalArgumentException("Invalid analysis task: document " + task.itemId() + " not found");
        }
        if (document.isAnalyzed()) {
            return StageOutcome.success(1, 1, 0, "Already analyzed");
        }
        AnalysisResult result = analysisClient.isEnabled()
            ? analysisClient.analyze(document)
            : summarize(document);
        documents.markAnalyzed(document.id(), result.documentType(), result.summary(), result.needsReview());
        return StageOutcome.success(1, 1, 0, "Analyzed " + document.instrumentNumber());
    }

    static AnalysisResult summarize(DocumentRecord document) {
        DocumentType type = document.documentType();
        StringBuilder summary = new StringBuilder(type.name().replace('_', ' ').toLowerCase(Locale.ROOT));
        if (document.instrumentNumber() != null) {
            summary.append(' ').append(document.instrumentNumber());
        }
        if (document.recordingDate() != null) {
            summary.append(" recorded ").append(document.recordingDate());
        }
        if (document.grantor() != null && !document.grantor().isBlank()) {
            summary.append(" from ").append(document.grantor());
        }
        if (document.grantee() != null && !document.grantee().isBlank()) {
            summary.append(" to ").append(document.grantee());
        }
        boolean needsReview = type == DocumentType.OTHER
            || document.recordingDate() == null
            || !document.isDownloaded();
        return new AnalysisResult(type, summary.toString(), needsReview);
    }
}
