package com.stackrelay.exception;

/**
 * The pending queue is full; the request was rejected without being queued.
 */
public class QueueSaturatedException extends StackApiException {

    public QueueSaturatedException(int maxPending) {
        super("Request queue is full (max pending: " + maxPending + ")");
    }
}
