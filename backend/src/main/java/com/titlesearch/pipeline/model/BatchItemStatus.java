package com.titlesearch.pipeline.model;

public enum BatchItemStatus {
    PENDING,
    COMPLETED,
    FAILED
}
