package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.DocumentType;

public record AnalysisResult(DocumentType documentType, String summary, boolean needsReview) {
}
