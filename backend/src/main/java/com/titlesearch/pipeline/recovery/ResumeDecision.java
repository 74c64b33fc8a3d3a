package com.titlesearch.pipeline.recovery;

public record ResumeDecision(boolean resumable, String reason) {
}
