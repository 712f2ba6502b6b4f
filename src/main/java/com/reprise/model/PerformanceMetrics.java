package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived performance figures, recomputed on every request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    /**
     * Hit rate as a percentage (0-100).
     */
    private double hitRate;

    private double avgAccessCount;

    private int medianAccessCount;

    /**
     * Cumulative tokens saved by hits.
     */
    private long totalSavings;

    /**
     * Token savings converted to currency.
     */
    private double estimatedCostSavings;

    /**
     * Hits per live entry.
     */
    private double cacheEfficiency;
}
