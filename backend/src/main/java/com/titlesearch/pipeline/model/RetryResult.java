package com.titlesearch.pipeline.model;

public record RetryResult(long searchId, PipelineStep resumeStep, String reason, String taskHandle) {
}
