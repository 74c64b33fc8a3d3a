package com.titlesearch.pipeline.adapter;

/**
 * The target site cannot be used at all. Fatal for the stage that needed it.
 */
public class RecorderUnavailableException extends RuntimeException {
    public RecorderUnavailableException(String message) {
        super(message);
    }

    public RecorderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
