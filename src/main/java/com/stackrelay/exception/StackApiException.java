package com.stackrelay.exception;

/**
 * Base class for failures surfaced by the dispatch layer.
 *
 * All exceptions in this project are unchecked; they travel to callers on the
 * futures returned by the request queue.
 */
public abstract class StackApiException extends RuntimeException {

    protected StackApiException(String message) {
        super(message);
    }

    protected StackApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
