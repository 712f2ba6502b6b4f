package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One cached prompt/response exchange plus its access metadata.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * Unique entry id.
     */
    private String id;

    /**
     * Hash of the normalized prompt, used to rebuild the key on import.
     */
    private String promptHash;

    /**
     * Hash of the normalized context, used to rebuild the key on import.
     */
    private String contextHash;

    /**
     * Prompt text as supplied by the caller.
     */
    private String prompt;

    /**
     * Cached response text.
     */
    private String response;

    private String model;

    private double temperature;

    /**
     * Total tokens the original completion consumed.
     */
    private int tokensUsed;

    private int inputTokens;

    private int outputTokens;

    private Instant createdAt;

    /**
     * Last time the entry was returned by a lookup. Never before createdAt.
     */
    private Instant accessedAt;

    /**
     * Starts at 1 on creation, incremented on every hit.
     */
    private int accessCount;

    /**
     * Detached copy, so callers never hold a reference into the table.
     */
    public CacheEntry copy() {
        return toBuilder().build();
    }
}
