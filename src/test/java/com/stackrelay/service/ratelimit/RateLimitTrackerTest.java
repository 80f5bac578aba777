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
 * Tests for RateLimitTracker.
 */
class RateLimitTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private RateLimitTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tracker = new RateLimitTracker(true, Duration.ofMinutes(5), clock);
    }

    @Test
    void testSnapshotsStartUnknown() {
        RateLimitSnapshot snapshot = tracker.snapshot(AccessMode.AUTHENTICATED);

        assertEquals(AccessMode.AUTHENTICATED, snapshot.getMode());
        assertNull(snapshot.getRemainingQuota());
        assertNull(snapshot.getResetAt());
        assertFalse(snapshot.isRateLimited(NOW));
    }

    @Test
    void testRecordMergesReportedFields() {
        tracker.record(AccessMode.AUTHENTICATED, QuotaInfo.builder().remaining(9000).max(10000).build());
        RateLimitSnapshot snapshot = tracker.record(AccessMode.AUTHENTICATED,
                QuotaInfo.builder().remaining(8999).build());

        assertEquals(8999, snapshot.getRemainingQuota());
        assertEquals(10000, snapshot.getQuotaMax());
        assertEquals(NOW, snapshot.getObservedAt());
        // the other mode is untouched
        assertNull(tracker.snapshot(AccessMode.UNAUTHENTICATED).getRemainingQuota());
    }

    @Test
    void testMissingResetDefaultsToNextUtcMidnight() {
        RateLimitSnapshot snapshot = tracker.record(AccessMode.UNAUTHENTICATED,
                QuotaInfo.builder().remaining(250).build());

        assertEquals(Instant.parse("2024-05-02T00:00:00Z"), snapshot.getResetAt());
    }

    @Test
    void testReportedResetWins() {
        Instant reset = NOW.plusSeconds(120);
        RateLimitSnapshot snapshot = tracker.record(AccessMode.AUTHENTICATED,
                QuotaInfo.builder().remaining(10).resetAt(reset).build());

        assertEquals(reset, snapshot.getResetAt());
    }

    @Test
    void testBackoffSetsBackoffUntil() {
        RateLimitSnapshot snapshot = tracker.record(AccessMode.AUTHENTICATED,
                QuotaInfo.builder().backoff(Duration.ofSeconds(10)).build());

        assertEquals(NOW.plusSeconds(10), snapshot.getBackoffUntil());
    }

    @Test
    void testMarkRateLimitedUsesRetryAfter() {
        RateLimitSnapshot snapshot = tracker.markRateLimited(AccessMode.AUTHENTICATED, Duration.ofSeconds(42));

        assertEquals(NOW.plusSeconds(42), snapshot.getRateLimitedUntil());
        assertTrue(snapshot.isRateLimited(NOW.plusSeconds(41)));
        assertFalse(snapshot.isRateLimited(NOW.plusSeconds(42)));
    }

    @Test
    void testMarkRateLimitedUsesResetOfDepletedWindow() {
        Instant reset = NOW.plus(Duration.ofHours(2));
        tracker.record(AccessMode.AUTHENTICATED, QuotaInfo.builder().remaining(0).resetAt(reset).build());

        RateLimitSnapshot snapshot = tracker.markRateLimited(AccessMode.AUTHENTICATED, null);

        assertEquals(reset, snapshot.getRateLimitedUntil());
    }

    @Test
    void testMarkRateLimitedFallsBackToCooldown() {
        RateLimitSnapshot snapshot = tracker.markRateLimited(AccessMode.AUTHENTICATED, null);

        assertEquals(NOW.plus(Duration.ofMinutes(5)), snapshot.getRateLimitedUntil());
    }

    @Test
    void testCredentials() {
        assertTrue(tracker.hasUsableCredentials());
        assertNull(tracker.getCredentialsValid());

        tracker.markCredentials(false, "invalid key");
        assertFalse(tracker.hasUsableCredentials());
        assertEquals("invalid key", tracker.getCredentialsError());

        tracker.markCredentials(true, null);
        assertTrue(tracker.hasUsableCredentials());
        assertNull(tracker.getCredentialsError());

        RateLimitTracker keyless = new RateLimitTracker(false, Duration.ofMinutes(5), clock);
        assertFalse(keyless.hasUsableCredentials());
    }

    @Test
    void testAutoIsNotATransportMode() {
        assertThrows(IllegalArgumentException.class, () -> tracker.snapshot(AccessMode.AUTO));
    }

    @Test
    void testNextDailyReset() {
        assertEquals(Instant.parse("2024-05-02T00:00:00Z"),
                RateLimitTracker.nextDailyReset(Instant.parse("2024-05-01T23:59:59Z")));
        assertEquals(Instant.parse("2024-05-02T00:00:00Z"),
                RateLimitTracker.nextDailyReset(Instant.parse("2024-05-01T00:00:00Z")));
    }

    @Test
    void testOversizedRetryAfterIsCappedAtOneDay() {
        RateLimitSnapshot snapshot = tracker.markRateLimited(AccessMode.AUTHENTICATED,
                Duration.ofSeconds(100_000_000_000_000_000L));

        assertEquals(NOW.plus(Duration.ofDays(1)), snapshot.getRateLimitedUntil());
    }

    @Test
    void testNegativeRetryAfterExpiresImmediately() {
        RateLimitSnapshot snapshot = tracker.markRateLimited(AccessMode.UNAUTHENTICATED, Duration.ofSeconds(-30));

        assertEquals(NOW, snapshot.getRateLimitedUntil());
        assertFalse(snapshot.isRateLimited(NOW));
    }
}
