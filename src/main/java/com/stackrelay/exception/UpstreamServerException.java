package com.stackrelay.exception;

/**
 * The API answered with a 5xx status or an internal/unavailable error id. Retried with backoff.
 */
public class UpstreamServerException extends StackApiException {

    private final int statusCode;

    public UpstreamServerException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
