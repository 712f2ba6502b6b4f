package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary view of a cache entry for list endpoints.
 * Response text is left out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntrySummary {

    private String id;

    private String model;

    private double temperature;

    /**
     * First 100 characters of the prompt.
     */
    private String promptPreview;

    private int responseLength;

    private int tokensUsed;

    private int accessCount;

    private Instant createdAt;

    private Instant accessedAt;
}
