package com.titlesearch.pipeline.recovery;

public record ManualAction(String action, String label, String description) {
}
