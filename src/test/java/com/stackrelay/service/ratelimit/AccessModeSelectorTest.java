package com.stackrelay.service.ratelimit;

import com.stackrelay.model.AccessMode;
import com.stackrelay.model.QuotaInfo;
import com.stackrelay.model.RateLimitSnapshot;
import com.stackrelay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AccessModeSelector.
 */
class AccessModeSelectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private RateLimitTracker tracker;
    private AccessModeSelector selector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tracker = new RateLimitTracker(true, Duration.ofMinutes(5), clock);
        selector = new AccessModeSelector(tracker, 50, clock);
    }

    @Test
    void testAutoPrefersAuthenticatedWhileQuotaUnknown() {
        assertEquals(AccessMode.AUTHENTICATED, selector.choose(AccessMode.AUTO));
    }

    @Test
    void testAutoFallsBackBelowLowWaterMark() {
        tracker.record(AccessMode.AUTHENTICATED, quota(49, NOW.plus(Duration.ofHours(1))));
        assertEquals(AccessMode.UNAUTHENTICATED, selector.choose(AccessMode.AUTO));

        tracker.record(AccessMode.AUTHENTICATED, quota(50, NOW.plus(Duration.ofHours(1))));
        assertEquals(AccessMode.AUTHENTICATED, selector.choose(AccessMode.AUTO));
    }

    @Test
    void testAutoReturnsToAuthenticatedAfterWindowReset() {
        Instant reset = NOW.plus(Duration.ofMinutes(10));
        tracker.record(AccessMode.AUTHENTICATED, quota(0, reset));
        assertEquals(AccessMode.UNAUTHENTICATED, selector.choose(AccessMode.AUTO));

        clock.set(reset);
        assertEquals(AccessMode.AUTHENTICATED, selector.choose(AccessMode.AUTO));
    }

    @Test
    void testAutoAvoidsRateLimitedAuthenticatedUntilMarkExpires() {
        tracker.markRateLimited(AccessMode.AUTHENTICATED, Duration.ofSeconds(30));
        assertEquals(AccessMode.UNAUTHENTICATED, selector.choose(AccessMode.AUTO));

        clock.advance(Duration.ofSeconds(30));
        assertEquals(AccessMode.AUTHENTICATED, selector.choose(AccessMode.AUTO));
    }

    @Test
    void testExplicitModesAreHonored() {
        tracker.record(AccessMode.AUTHENTICATED, quota(0, NOW.plus(Duration.ofHours(1))));

        assertEquals(AccessMode.AUTHENTICATED, selector.choose(AccessMode.AUTHENTICATED));
        assertEquals(AccessMode.UNAUTHENTICATED, selector.choose(AccessMode.UNAUTHENTICATED));
    }

    @Test
    void testNoCredentialsMeansUnauthenticated() {
        RateLimitTracker keyless = new RateLimitTracker(false, Duration.ofMinutes(5), clock);
        AccessModeSelector keylessSelector = new AccessModeSelector(keyless, 50, clock);

        assertEquals(AccessMode.UNAUTHENTICATED, keylessSelector.choose(AccessMode.AUTO));
        assertEquals(AccessMode.UNAUTHENTICATED, keylessSelector.choose(AccessMode.AUTHENTICATED));
    }

    @Test
    void testRejectedKeyMeansUnauthenticated() {
        tracker.markCredentials(false, "key is invalid");

        assertEquals(AccessMode.UNAUTHENTICATED, selector.choose(AccessMode.AUTO));
    }

    @Test
    void testPreviewDoesNotRecordChoice() {
        assertEquals(AccessMode.AUTHENTICATED, selector.preview(AccessMode.AUTO));
        assertNull(selector.lastChoice());

        selector.choose(AccessMode.AUTO);
        assertEquals(AccessMode.AUTHENTICATED, selector.lastChoice());
    }

    @Test
    void testDecideIsPure() {
        RateLimitSnapshot healthy = RateLimitSnapshot.builder()
                .mode(AccessMode.AUTHENTICATED)
                .remainingQuota(9000)
                .build();
        RateLimitSnapshot depleted = healthy.toBuilder()
                .remainingQuota(0)
                .resetAt(NOW.plusSeconds(60))
                .build();

        assertEquals(AccessMode.AUTHENTICATED, AccessModeSelector.decide(AccessMode.AUTO, true, healthy, 50, NOW));
        assertEquals(AccessMode.UNAUTHENTICATED, AccessModeSelector.decide(AccessMode.AUTO, true, depleted, 50, NOW));
        assertEquals(AccessMode.AUTHENTICATED,
                AccessModeSelector.decide(AccessMode.AUTO, true, depleted, 50, NOW.plusSeconds(60)));
        assertEquals(AccessMode.UNAUTHENTICATED, AccessModeSelector.decide(AccessMode.AUTO, false, healthy, 50, NOW));
    }

    private static QuotaInfo quota(int remaining, Instant resetAt) {
        return QuotaInfo.builder()
                .remaining(remaining)
                .max(10000)
                .resetAt(resetAt)
                .build();
    }
}
