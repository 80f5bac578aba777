package com.stackrelay.model;

/**
 * Transport mode for calls to the Stack Exchange API.
 *
 * The API grants a much larger daily quota to requests carrying an application key
 * (10,000 versus 300 per IP). AUTO lets the selector pick per call.
 */
public enum AccessMode {
    /**
     * Attach the configured API key.
     */
    AUTHENTICATED,

    /**
     * Anonymous call, counted against the per-IP quota.
     */
    UNAUTHENTICATED,

    /**
     * Decide per call from the latest quota snapshot. Only valid as a configured value.
     */
    AUTO
}
