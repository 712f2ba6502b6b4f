package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache statistics for the admin dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Live entry count.
     */
    private long totalEntries;

    private long totalHits;

    private long totalMisses;

    /**
     * Cache hit rate as a percentage (0-100).
     */
    private double hitRate;

    /**
     * Total tokens saved from cache hits.
     */
    private long tokensSaved;

    /**
     * Estimated cost savings in USD.
     */
    private double costSavings;

    private long cacheSizeBytes;

    /**
     * Human-readable size, e.g. "1.5 KB".
     */
    private String cacheSize;

    private double avgAccessCount;

    private int medianAccessCount;

    /**
     * Hits per live entry.
     */
    private double cacheEfficiency;

    private boolean enabled;

    private int maxEntries;

    private int maxAgeDays;
}
