package com.titlesearch.pipeline.service;

public class DocumentDownloadException extends RuntimeException {
    public DocumentDownloadException(String message) {
        super(message);
    }
}
