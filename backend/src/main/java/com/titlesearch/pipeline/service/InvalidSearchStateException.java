package com.titlesearch.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidSearchStateException extends RuntimeException {
    public InvalidSearchStateException(String message) {
        super(message);
    }
}
