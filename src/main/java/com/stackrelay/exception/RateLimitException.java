package com.stackrelay.exception;

import java.time.Duration;

/**
 * The API refused the call because a quota or throttle limit was hit.
 *
 * On the authenticated transport this triggers a fallback to anonymous access
 * instead of a retry.
 */
public class RateLimitException extends StackApiException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /**
     * Upstream hint from {@code Retry-After} or the {@code backoff} field; null when absent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
