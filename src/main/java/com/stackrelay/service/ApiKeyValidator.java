package com.stackrelay.service;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.service.ratelimit.RateLimitTracker;
import com.stackrelay.service.transport.StackExchangeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Checks the configured API key once the application is up.
 *
 * A key the API rejects is marked invalid so the selector stops attaching it;
 * network or server trouble leaves its validity unknown.
 */
@Slf4j
@Service
public class ApiKeyValidator {

    private final StackExchangeTransport transport;
    private final RateLimitTracker tracker;
    private final StackRelayProperties.ApiConfig config;

    public ApiKeyValidator(StackExchangeTransport transport,
                           RateLimitTracker tracker,
                           StackRelayProperties properties) {
        this.transport = transport;
        this.tracker = tracker;
        this.config = properties.getApi();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateOnStartup() {
        if (!config.hasApiKey()) {
            log.info("No API key configured, using unauthenticated access");
            return;
        }
        if (!config.isValidateKeyOnStartup()) {
            log.info("API key validation on startup disabled");
            return;
        }

        validate().subscribe(
                valid -> log.debug("API key validation finished: valid={}", valid),
                error -> log.warn("API key validation failed: {}", error.getMessage()));
    }

    /**
     * Call {@code info} with the key attached.
     *
     * @return true if accepted, false if rejected; empty when the outcome is unknown
     */
    public Mono<Boolean> validate() {
        ApiRequest request = ApiRequest.of(ApiOperation.API_INFO, Map.of("site", config.getSite()));

        return transport.execute(request, AccessMode.AUTHENTICATED)
                .map(response -> {
                    tracker.record(AccessMode.AUTHENTICATED, response.getQuota());
                    tracker.markCredentials(true, null);
                    return true;
                })
                .onErrorResume(ValidationException.class, error -> {
                    tracker.markCredentials(false, error.getMessage());
                    return Mono.just(false);
                })
                .onErrorResume(error -> {
                    log.warn("Could not validate API key, validity unknown: {}", error.getMessage());
                    return Mono.empty();
                });
    }
}
