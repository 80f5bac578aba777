package com.stackrelay.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * A completed response held by {@link ResultCache}.
 */
@Value
public class CacheEntry {
    String fingerprint;
    JsonNode payload;
    Instant storedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
