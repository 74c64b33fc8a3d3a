package com.titlesearch.pipeline.browser;

public class BrowserPoolException extends RuntimeException {
    public BrowserPoolException(String message) {
        super(message);
    }

    public BrowserPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
