package com.stackrelay.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory result cache bounded by TTL and entry count.
 *
 * Entries live for a fixed TTL after being stored. When the entry count exceeds
 * the capacity, the least-recently-used entry is evicted; both {@link #store}
 * and a successful {@link #lookup} count as use. Every operation runs under the
 * instance monitor, so workers can share one cache.
 */
@Slf4j
@Service
public class ResultCache {

    private final Clock clock;
    private final Duration ttl;
    private final int maxSize;

    // access-order map: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long evictions;

    @Autowired
    public ResultCache(StackRelayProperties properties, Clock clock) {
        this(properties.getCache().getTtl(), properties.getCache().getMaxSize(), clock);
    }

    public ResultCache(Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got: " + ttl);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache max size must be >= 1, got: " + maxSize);
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Get a cached payload.
     *
     * @param fingerprint request fingerprint
     * @return payload if present and not expired
     */
    public synchronized Optional<JsonNode> lookup(String fingerprint) {
        CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            entries.remove(fingerprint);
            log.debug("Cache entry expired: {}", fingerprint);
            return Optional.empty();
        }

        return Optional.of(entry.getPayload());
    }

    /**
     * Store or overwrite a payload, evicting the least-recently-used entry when over capacity.
     */
    public synchronized void store(String fingerprint, JsonNode payload) {
        Instant now = clock.instant();
        entries.put(fingerprint, new CacheEntry(fingerprint, payload, now, now.plus(ttl)));

        while (entries.size() > maxSize) {
            Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
            String evicted = eldest.next().getKey();
            eldest.remove();
            evictions++;
            log.debug("Evicted least recently used entry: {}", evicted);
        }
    }

    /**
     * Remove all expired entries.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${stackrelay.cache.purge-interval:PT1M}",
            initialDelayString = "${stackrelay.cache.purge-interval:PT1M}")
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        // values().removeIf does not touch access order
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired cache entries, {} remain", purged, entries.size());
        }
        return purged;
    }

    public synchronized void clear() {
        int size = entries.size();
        entries.clear();
        log.info("Cleared {} cache entries", size);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStatistics statistics() {
        Instant now = clock.instant();
        int valid = (int) entries.values().stream()
                .filter(entry -> !entry.isExpired(now))
                .count();

        return CacheStatistics.builder()
                .totalEntries(entries.size())
                .validEntries(valid)
                .maxSize(maxSize)
                .ttlSeconds(ttl.toSeconds())
                .evictions(evictions)
                .build();
    }
}
