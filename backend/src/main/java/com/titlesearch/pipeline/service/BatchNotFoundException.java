package com.titlesearch.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class BatchNotFoundException extends RuntimeException {
    public BatchNotFoundException(long batchId) {
        super("Batch " + batchId + " not found");
    }
}
