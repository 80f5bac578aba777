package com.stackrelay.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Quota metadata reported with one upstream response. Every field is optional.
 */
@Value
@Builder
public class QuotaInfo {

    private static final QuotaInfo EMPTY = QuotaInfo.builder().build();

    /**
     * {@code quota_remaining} body field or {@code x-ratelimit-remaining} header.
     */
    Integer remaining;

    /**
     * {@code quota_max} body field.
     */
    Integer max;

    /**
     * {@code x-ratelimit-reset} header, when the upstream sends one.
     */
    Instant resetAt;

    /**
     * {@code backoff} body field: seconds to wait before calling the same method again.
     */
    Duration backoff;

    public static QuotaInfo empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return remaining == null && max == null && resetAt == null && backoff == null;
    }
}
