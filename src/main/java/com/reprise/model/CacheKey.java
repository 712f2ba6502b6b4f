package com.reprise.model;

/**
 * Composite cache key derived from normalized request parameters.
 * Component order is significant.
 *
 * @param promptHash  hash of the trimmed, lower-cased prompt
 * @param contextHash hash of the trimmed, lower-cased context
 * @param model       model identifier, verbatim
 * @param temperature temperature formatted with two decimal digits
 */
public record CacheKey(String promptHash, String contextHash, String model, String temperature) {

    /**
     * String form used as the table key.
     */
    public String asString() {
        return promptHash + "_" + contextHash + "_" + model + "_" + temperature;
    }

    @Override
    public String toString() {
        return asString();
    }
}
