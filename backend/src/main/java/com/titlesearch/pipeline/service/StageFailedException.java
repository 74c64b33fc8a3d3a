package com.titlesearch.pipeline.service;

/**
 * Raised by a fan-out stage when none of its items succeeded. The message ends with the last item
 * error so the stage is classified like the items were.
 */
public class StageFailedException extends RuntimeException {
    public StageFailedException(String message) {
        super(message);
    }
}
