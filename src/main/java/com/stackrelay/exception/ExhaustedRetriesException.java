package com.stackrelay.exception;

/**
 * Terminal failure after the retry budget was spent. Wraps the last underlying error.
 */
public class ExhaustedRetriesException extends StackApiException {

    private final int attempts;

    public ExhaustedRetriesException(int attempts, Throwable lastError) {
        super("Request failed after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    /**
     * Number of calls made, including the first one.
     */
    public int getAttempts() {
        return attempts;
    }
}
