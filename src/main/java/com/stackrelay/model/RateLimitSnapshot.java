package com.stackrelay.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Last observed quota state for one transport mode.
 *
 * Snapshots are immutable; the tracker replaces them wholesale after every upstream response.
 */
@Value
@Builder(toBuilder = true)
public class RateLimitSnapshot {

    AccessMode mode;

    /**
     * Remaining calls in the current window, or null before the first response.
     */
    Integer remainingQuota;

    Integer quotaMax;

    /**
     * When the current quota window ends.
     */
    Instant resetAt;

    /**
     * Set after a rate-limit error; the mode is avoided until this passes.
     */
    Instant rateLimitedUntil;

    /**
     * Upstream-requested pause before the next call in this mode.
     */
    Instant backoffUntil;

    Instant observedAt;

    public static RateLimitSnapshot unknown(AccessMode mode) {
        return RateLimitSnapshot.builder().mode(mode).build();
    }

    public boolean isRateLimited(Instant now) {
        return rateLimitedUntil != null && now.isBefore(rateLimitedUntil);
    }

    public boolean isBelow(int lowWaterMark, Instant now) {
        if (remainingQuota == null || remainingQuota >= lowWaterMark) {
            return false;
        }
        // A depleted window stops mattering once it has reset
        return resetAt == null || now.isBefore(resetAt);
    }
}
