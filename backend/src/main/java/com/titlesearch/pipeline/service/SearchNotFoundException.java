package com.titlesearch.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SearchNotFoundException extends RuntimeException {
    public SearchNotFoundException(long searchId) {
        super("Search " + searchId + " not found");
    }
}
