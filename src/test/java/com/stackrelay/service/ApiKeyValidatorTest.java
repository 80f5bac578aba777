package com.stackrelay.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.TransientNetworkException;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.QuotaInfo;
import com.stackrelay.model.UpstreamResponse;
import com.stackrelay.service.ratelimit.RateLimitTracker;
import com.stackrelay.support.FakeTransport;
import com.stackrelay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ApiKeyValidator.
 */
class ApiKeyValidatorTest {

    private StackRelayProperties properties;
    private RateLimitTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new StackRelayProperties();
        properties.getApi().setApiKey("test-key");
        tracker = new RateLimitTracker(true, Duration.ofMinutes(5),
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    @Test
    void testAcceptedKeyRecordsQuota() {
        FakeTransport transport = new FakeTransport((request, mode) -> Mono.just(new UpstreamResponse(
                JsonNodeFactory.instance.objectNode(),
                QuotaInfo.builder().remaining(9998).max(10000).build())));

        assertEquals(Boolean.TRUE, new ApiKeyValidator(transport, tracker, properties).validate().block());

        assertEquals(Boolean.TRUE, tracker.getCredentialsValid());
        assertEquals(9998, tracker.snapshot(AccessMode.AUTHENTICATED).getRemainingQuota());
        FakeTransport.Call call = transport.calls().get(0);
        assertEquals(ApiOperation.API_INFO, call.getRequest().getOperation());
        assertEquals(AccessMode.AUTHENTICATED, call.getMode());
    }

    @Test
    void testRejectedKeyDisablesCredentials() {
        FakeTransport transport = new FakeTransport((request, mode) ->
                Mono.error(new ValidationException("Stack Exchange API error: key_invalid - invalid key", 405)));

        assertEquals(Boolean.FALSE, new ApiKeyValidator(transport, tracker, properties).validate().block());

        assertFalse(tracker.hasUsableCredentials());
        assertTrue(tracker.getCredentialsError().contains("key_invalid"));
    }

    @Test
    void testNetworkTroubleLeavesValidityUnknown() {
        FakeTransport transport = new FakeTransport((request, mode) ->
                Mono.error(new TransientNetworkException("Network error calling info", new IOException("reset"))));

        assertNull(new ApiKeyValidator(transport, tracker, properties).validate().block());

        assertNull(tracker.getCredentialsValid());
        assertTrue(tracker.hasUsableCredentials());
    }

    @Test
    void testStartupCheckSkippedWithoutKey() {
        properties.getApi().setApiKey(null);
        FakeTransport transport = new FakeTransport((request, mode) -> Mono.error(new IllegalStateException("unexpected")));

        new ApiKeyValidator(transport, tracker, properties).validateOnStartup();

        assertEquals(0, transport.callCount());
    }

    @Test
    void testStartupCheckCanBeDisabled() {
        properties.getApi().setValidateKeyOnStartup(false);
        FakeTransport transport = new FakeTransport((request, mode) -> Mono.error(new IllegalStateException("unexpected")));

        new ApiKeyValidator(transport, tracker, properties).validateOnStartup();

        assertEquals(0, transport.callCount());
    }
}
