package com.stackrelay.exception;

/**
 * Connection failure, reset or response timeout. Retried with backoff.
 */
public class TransientNetworkException extends StackApiException {

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
