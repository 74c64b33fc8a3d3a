package com.titlesearch.pipeline.model;

public enum DocumentSource {
    COUNTY_RECORDER,
    COURT_RECORDS,
    MANUAL_UPLOAD
}
