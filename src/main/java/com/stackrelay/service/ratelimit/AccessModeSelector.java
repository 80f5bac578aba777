package com.stackrelay.service.ratelimit;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.RateLimitSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides, per outgoing call, whether to attach the API key.
 *
 * The decision itself is the pure function {@link #decide}; this bean only feeds it
 * the current snapshot and logs transitions.
 */
@Slf4j
@Service
public class AccessModeSelector {

    private final RateLimitTracker tracker;
    private final Clock clock;
    private final int lowWaterMark;

    private final AtomicReference<AccessMode> lastChoice = new AtomicReference<>();

    @Autowired
    public AccessModeSelector(RateLimitTracker tracker, StackRelayProperties properties, Clock clock) {
        this(tracker, properties.getQuota().getLowWaterMark(), clock);
    }

    public AccessModeSelector(RateLimitTracker tracker, int lowWaterMark, Clock clock) {
        this.tracker = tracker;
        this.lowWaterMark = lowWaterMark;
        this.clock = clock;
    }

    /**
     * Choose the transport for the next call.
     *
     * @param configuredMode configured access mode (AUTO, AUTHENTICATED or UNAUTHENTICATED)
     * @return AUTHENTICATED or UNAUTHENTICATED
     */
    public AccessMode choose(AccessMode configuredMode) {
        AccessMode chosen = preview(configuredMode);

        AccessMode previous = lastChoice.getAndSet(chosen);
        if (previous != null && previous != chosen) {
            log.info("Switching access mode {} -> {} (configured: {})", previous, chosen, configuredMode);
        }
        return chosen;
    }

    /**
     * What {@link #choose} would return right now, without recording it.
     */
    public AccessMode preview(AccessMode configuredMode) {
        return decide(
                configuredMode,
                tracker.hasUsableCredentials(),
                tracker.snapshot(AccessMode.AUTHENTICATED),
                lowWaterMark,
                clock.instant());
    }

    /**
     * The selection rule.
     *
     * <ul>
     *   <li>Explicit modes are honored, except AUTHENTICATED without usable credentials.</li>
     *   <li>AUTO prefers AUTHENTICATED while its quota is unknown or at/above the low-water mark
     *       and no rate-limit mark is active; otherwise UNAUTHENTICATED until the window resets.</li>
     * </ul>
     */
    public static AccessMode decide(AccessMode configuredMode,
                                    boolean credentialsAvailable,
                                    RateLimitSnapshot authenticated,
                                    int lowWaterMark,
                                    Instant now) {
        if (!credentialsAvailable || configuredMode == AccessMode.UNAUTHENTICATED) {
            return AccessMode.UNAUTHENTICATED;
        }
        if (configuredMode == AccessMode.AUTHENTICATED) {
            return AccessMode.AUTHENTICATED;
        }

        if (authenticated.isRateLimited(now) || authenticated.isBelow(lowWaterMark, now)) {
            return AccessMode.UNAUTHENTICATED;
        }
        return AccessMode.AUTHENTICATED;
    }

    /**
     * Last mode handed out, or null before the first call.
     */
    public AccessMode lastChoice() {
        return lastChoice.get();
    }

    public int getLowWaterMark() {
        return lowWaterMark;
    }
}
