package com.stackrelay.service.ratelimit;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.RateLimitSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Client-side pacing of upstream calls.
 *
 * Calls are spaced at least {@code 60s / maxRequestsPerMinute} apart across all workers,
 * and no call is issued in a mode whose snapshot carries an active upstream {@code backoff}.
 * The throttle only hands out wait times; the caller does the waiting.
 */
@Slf4j
@Service
public class RequestThrottle {

    private final RateLimitTracker tracker;
    private final Clock clock;

    /**
     * null when pacing is disabled.
     */
    private final Duration minInterval;

    private Instant nextSlot;

    @Autowired
    public RequestThrottle(RateLimitTracker tracker, StackRelayProperties properties, Clock clock) {
        this(tracker, properties.getQuota().getMaxRequestsPerMinute(), clock);
    }

    public RequestThrottle(RateLimitTracker tracker, int maxRequestsPerMinute, Clock clock) {
        if (maxRequestsPerMinute < 0) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be >= 0, got: " + maxRequestsPerMinute);
        }
        this.tracker = tracker;
        this.clock = clock;
        this.minInterval = maxRequestsPerMinute == 0
                ? null
                : Duration.ofMinutes(1).dividedBy(maxRequestsPerMinute);
    }

    /**
     * Reserve the next call slot for the given mode.
     *
     * @return how long the caller must wait before issuing the call (zero if it may go now)
     */
    public synchronized Duration reserve(AccessMode mode) {
        Instant now = clock.instant();
        Instant slot = now;

        if (nextSlot != null && nextSlot.isAfter(slot)) {
            slot = nextSlot;
        }

        RateLimitSnapshot snapshot = tracker.snapshot(mode);
        if (snapshot.getBackoffUntil() != null && snapshot.getBackoffUntil().isAfter(slot)) {
            slot = snapshot.getBackoffUntil();
        }

        if (minInterval != null) {
            nextSlot = slot.plus(minInterval);
        }

        Duration wait = Duration.between(now, slot);
        if (!wait.isZero()) {
            log.debug("Throttling {} call for {}ms", mode, wait.toMillis());
        }
        return wait;
    }

    public boolean isEnabled() {
        return minInterval != null;
    }
}
