package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cache configuration. Fields missing from a deserialized document keep their defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheSettings {

    public static final boolean DEFAULT_ENABLED = true;
    public static final int DEFAULT_MAX_ENTRIES = 100;
    public static final int DEFAULT_MAX_AGE_DAYS = 30;
    public static final double DEFAULT_MATCH_THRESHOLD = 1.0;

    private boolean enabled = DEFAULT_ENABLED;

    /**
     * Hard capacity.
     */
    private int maxEntries = DEFAULT_MAX_ENTRIES;

    /**
     * Time-to-live in days, measured from creation.
     */
    private int maxAgeDays = DEFAULT_MAX_AGE_DAYS;

    /**
     * Reserved for approximate matching (0-1). Stored and exported, never read by lookups.
     */
    private double matchThreshold = DEFAULT_MATCH_THRESHOLD;

    public static CacheSettings defaults() {
        return new CacheSettings();
    }

    public CacheSettings copy() {
        return new CacheSettings(enabled, maxEntries, maxAgeDays, matchThreshold);
    }

    /**
     * Range problems with the current values, empty when valid.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (!isValidMaxEntries(maxEntries)) {
            problems.add("maxEntries must be at least 1, was " + maxEntries);
        }
        if (!isValidMaxAgeDays(maxAgeDays)) {
            problems.add("maxAgeDays must not be negative, was " + maxAgeDays);
        }
        if (!isValidMatchThreshold(matchThreshold)) {
            problems.add("matchThreshold must be within [0, 1], was " + matchThreshold);
        }
        return problems;
    }

    /**
     * Copy with every out-of-range field reset to its default.
     */
    public CacheSettings sanitized() {
        return new CacheSettings(
                enabled,
                isValidMaxEntries(maxEntries) ? maxEntries : DEFAULT_MAX_ENTRIES,
                isValidMaxAgeDays(maxAgeDays) ? maxAgeDays : DEFAULT_MAX_AGE_DAYS,
                isValidMatchThreshold(matchThreshold) ? matchThreshold : DEFAULT_MATCH_THRESHOLD);
    }

    static boolean isValidMaxEntries(int value) {
        return value >= 1;
    }

    static boolean isValidMaxAgeDays(int value) {
        return value >= 0;
    }

    static boolean isValidMatchThreshold(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
