package com.titlesearch.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titlesearch.config.PipelineProperties;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentType;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON client for the external document analysis service.
 */
@Service
public class AnalysisServiceClient {
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public AnalysisServiceClient(PipelineProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getAnalysis().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public boolean isEnabled() {
        return properties.getAnalysis().isEnabled();
    }

    public AnalysisResult analyze(DocumentRecord document) {
        PipelineProperties.Analysis settings = properties.getAnalysis();
        String body = writeRequest(document);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(settings.getEndpoint()))
            .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", properties.getUserAgent())
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + settings.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AnalysisServiceException("Analysis service request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisServiceException("Analysis service request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new AnalysisServiceException("Analysis service rate limit: HTTP 429 too many requests", status);
        }
        if (status < 200 || status >= 300) {
            throw new AnalysisServiceException("Analysis service returned HTTP " + status, status);
        }
        return readResult(document, response.body());
    }

    private String writeRequest(DocumentRecord document) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("documentId", document.id());
        payload.put("documentType", document.documentType().name());
        payload.put("instrumentNumber", document.instrumentNumber());
        payload.put("recordingDate", document.recordingDate());
        payload.put("grantor", document.grantor());
        payload.put("grantee", document.grantee());
        payload.put("filePath", document.filePath());
        payload.put("contentHash", document.contentHash());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis request for document " + document.id(), e);
        }
    }

    private AnalysisResult readResult(DocumentRecord document, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AnalysisServiceException("Analysis service returned invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisServiceException("Analysis service returned invalid JSON", 200);
        }
        DocumentType type = root.hasNonNull("documentType")
            ? DocumentType.parse(root.get("documentType").asText())
            : document.documentType();
        if (type == DocumentType.OTHER) {
            type = document.documentType();
        }
        String summary = root.path("summary").asText(null);
        boolean needsReview = root.path("needsReview").asBoolean(summary == null);
        return new AnalysisResult(type, summary, needsReview);
    }
}
