package com.stackrelay.service.ratelimit;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.QuotaInfo;
import com.stackrelay.model.RateLimitSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the latest quota snapshot for each transport mode and the validity of the configured key.
 *
 * Written only by the dispatcher (after every upstream response) and the startup key
 * validator; read by {@link AccessModeSelector} and {@link RequestThrottle}. All
 * replacements go through the instance monitor so concurrent workers cannot lose updates.
 */
@Slf4j
@Service
public class RateLimitTracker {

    /**
     * Longest honoured upstream hint: quotas reset at least once a day.
     */
    static final Duration MAX_RATE_LIMIT_HINT = Duration.ofDays(1);

    private final Clock clock;
    private final boolean apiKeyConfigured;
    private final Duration rateLimitCooldown;

    private final Map<AccessMode, RateLimitSnapshot> snapshots = new EnumMap<>(AccessMode.class);

    /**
     * null until the key has been checked.
     */
    private Boolean credentialsValid;
    private String credentialsError;

    @Autowired
    public RateLimitTracker(StackRelayProperties properties, Clock clock) {
        this(properties.getApi().hasApiKey(), properties.getQuota().getRateLimitCooldown(), clock);
    }

    public RateLimitTracker(boolean apiKeyConfigured, Duration rateLimitCooldown, Clock clock) {
        this.apiKeyConfigured = apiKeyConfigured;
        this.rateLimitCooldown = rateLimitCooldown;
        this.clock = clock;
        snapshots.put(AccessMode.AUTHENTICATED, RateLimitSnapshot.unknown(AccessMode.AUTHENTICATED));
        snapshots.put(AccessMode.UNAUTHENTICATED, RateLimitSnapshot.unknown(AccessMode.UNAUTHENTICATED));
    }

    public synchronized RateLimitSnapshot snapshot(AccessMode mode) {
        return snapshots.get(requireTransportMode(mode));
    }

    /**
     * Replace the snapshot of a mode with what an upstream response reported.
     * Fields the response did not carry keep their previous value.
     */
    public synchronized RateLimitSnapshot record(AccessMode mode, QuotaInfo quota) {
        Instant now = clock.instant();
        RateLimitSnapshot previous = snapshots.get(requireTransportMode(mode));
        RateLimitSnapshot.RateLimitSnapshotBuilder next = previous.toBuilder().observedAt(now);

        if (quota.getRemaining() != null) {
            next.remainingQuota(quota.getRemaining());
        }
        if (quota.getMax() != null) {
            next.quotaMax(quota.getMax());
        }
        if (quota.getResetAt() != null) {
            next.resetAt(quota.getResetAt());
        } else if (previous.getResetAt() == null || !now.isBefore(previous.getResetAt())) {
            next.resetAt(nextDailyReset(now));
        }
        if (quota.getBackoff() != null) {
            next.backoffUntil(now.plus(clampHint(quota.getBackoff())));
            log.info("Upstream requested {}s backoff for {} calls", quota.getBackoff().toSeconds(), mode);
        }

        RateLimitSnapshot snapshot = next.build();
        snapshots.put(mode, snapshot);
        log.debug("Quota for {}: remaining={}, max={}, resetAt={}",
                mode, snapshot.getRemainingQuota(), snapshot.getQuotaMax(), snapshot.getResetAt());
        return snapshot;
    }

    /**
     * Mark a mode as rate limited after the API refused a call.
     *
     * @param retryAfter upstream hint, capped at {@link #MAX_RATE_LIMIT_HINT}; when null the current
     *                   window reset (if known and in the future) or the configured cooldown is used
     */
    public synchronized RateLimitSnapshot markRateLimited(AccessMode mode, Duration retryAfter) {
        Instant now = clock.instant();
        RateLimitSnapshot previous = snapshots.get(requireTransportMode(mode));

        Instant until;
        if (retryAfter != null) {
            until = now.plus(clampHint(retryAfter));
        } else if (previous.getResetAt() != null && now.isBefore(previous.getResetAt())
                && previous.getRemainingQuota() != null && previous.getRemainingQuota() == 0) {
            until = previous.getResetAt();
        } else {
            until = now.plus(rateLimitCooldown);
        }

        RateLimitSnapshot snapshot = previous.toBuilder()
                .rateLimitedUntil(until)
                .observedAt(now)
                .build();
        snapshots.put(mode, snapshot);
        log.warn("{} access rate limited until {}", mode, until);
        return snapshot;
    }

    public synchronized void markCredentials(boolean valid, String error) {
        this.credentialsValid = valid;
        this.credentialsError = valid ? null : error;
        if (valid) {
            log.info("API key validated");
        } else {
            log.warn("API key rejected: {}. Falling back to unauthenticated access", error);
        }
    }

    /**
     * True when a key is configured and has not been reported invalid.
     */
    public synchronized boolean hasUsableCredentials() {
        return apiKeyConfigured && !Boolean.FALSE.equals(credentialsValid);
    }

    public boolean isApiKeyConfigured() {
        return apiKeyConfigured;
    }

    public synchronized Boolean getCredentialsValid() {
        return credentialsValid;
    }

    public synchronized String getCredentialsError() {
        return credentialsError;
    }

    /**
     * Stack Exchange quotas reset daily at midnight UTC.
     */
    static Instant nextDailyReset(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC)
                .plusDays(1)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }

    private static Duration clampHint(Duration retryAfter) {
        if (retryAfter.isNegative()) {
            return Duration.ZERO;
        }
        if (retryAfter.compareTo(MAX_RATE_LIMIT_HINT) > 0) {
            log.warn("Ignoring oversized rate limit hint of {}s, using {}", retryAfter.getSeconds(), MAX_RATE_LIMIT_HINT);
            return MAX_RATE_LIMIT_HINT;
        }
        return retryAfter;
    }

    private static AccessMode requireTransportMode(AccessMode mode) {
        if (mode == null || mode == AccessMode.AUTO) {
            throw new IllegalArgumentException("Snapshots exist per transport mode, got: " + mode);
        }
        return mode;
    }
}
