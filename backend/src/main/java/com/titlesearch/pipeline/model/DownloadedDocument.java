package com.titlesearch.pipeline.model;

public record DownloadedDocument(String filePath, long fileSize, String contentHash) {
}
