package com.stackrelay.exception;

/**
 * Bad parameters, either rejected locally or by the API (4xx other than throttling). Never retried.
 */
public class ValidationException extends StackApiException {

    private final Integer errorId;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Integer errorId) {
        super(message);
        this.errorId = errorId;
    }

    /**
     * Stack Exchange {@code error_id}, when the API reported one.
     */
    public Integer getErrorId() {
        return errorId;
    }
}
