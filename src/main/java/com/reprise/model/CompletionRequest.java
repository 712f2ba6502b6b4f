package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request parameters that identify a completion for caching.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {

    private String prompt;

    /**
     * Supporting context, may be null.
     */
    private String context;

    private String model;

    private double temperature;
}
