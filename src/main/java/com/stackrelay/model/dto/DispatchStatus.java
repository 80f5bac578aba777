package com.stackrelay.model.dto;

import com.stackrelay.model.AccessMode;
import com.stackrelay.model.RateLimitSnapshot;
import com.stackrelay.model.RequestPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time view of the dispatch layer for status reporting.
 *
 * Lets an operator tell "temporarily degraded" (anonymous mode, still succeeding)
 * from "failing" (terminal failures accumulating).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchStatus {

    /**
     * Requests waiting for a worker, per priority band.
     */
    private Map<RequestPriority, Integer> pendingByPriority;

    private int pending;

    private int inFlight;

    /**
     * Requests waiting out a retry delay.
     */
    private int backingOff;

    private long completed;

    private long failed;

    /**
     * Callers attached to an already live request instead of causing a new call.
     */
    private long deduplicated;

    /**
     * Pending requests dropped because every caller stopped waiting.
     */
    private long skipped;

    /**
     * Callers turned away by a full queue.
     */
    private long rejected;

    private int maxPending;

    /**
     * Age of the oldest unresolved request (pending, in flight or backing off), 0 when idle.
     */
    private long oldestPendingAgeMs;

    private long cacheHits;

    private long cacheMisses;

    private double cacheHitRate;

    private CacheStatistics cache;

    private AccessMode configuredAccessMode;

    /**
     * Mode the next call would use.
     */
    private AccessMode currentAccessMode;

    /**
     * Remaining quota of the current mode, null while unknown.
     */
    private Integer quotaRemaining;

    private RateLimitSnapshot authenticatedQuota;

    private RateLimitSnapshot unauthenticatedQuota;

    private boolean apiKeyConfigured;

    /**
     * Result of the startup key check; null when not (yet) checked.
     */
    private Boolean apiKeyValid;

    private int maxConcurrent;

    private boolean workersRunning;

    private boolean throttleEnabled;
}
