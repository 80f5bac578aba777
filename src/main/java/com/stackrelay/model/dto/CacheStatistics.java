package com.stackrelay.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result cache occupancy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Entries currently held, expired ones included until purged.
     */
    private int totalEntries;

    /**
     * Entries that would still be served.
     */
    private int validEntries;

    private int maxSize;

    private long ttlSeconds;

    /**
     * Entries dropped for capacity since startup.
     */
    private long evictions;
}
