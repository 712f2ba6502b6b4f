package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate cache counters.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    /**
     * Live entry count, recomputed from the table.
     */
    private long totalEntries;

    private long totalHits;

    private long totalMisses;

    /**
     * Sum of tokensUsed over all hits.
     */
    private long estimatedSavings;

    /**
     * Approximate bytes: prompt + response length plus fixed overhead per entry.
     */
    private long cacheSize;

    public CacheStats copy() {
        return toBuilder().build();
    }
}
