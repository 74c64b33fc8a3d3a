package com.titlesearch.pipeline.service;

public class AnalysisServiceException extends RuntimeException {
    private final int statusCode;

    public AnalysisServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AnalysisServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /** HTTP status returned by the service, or 0 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
