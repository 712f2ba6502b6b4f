package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One item of a batch store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheWrite {

    private String prompt;
    private String context;
    private String model;
    private double temperature;
    private String response;
    private int tokensUsed;
    private int inputTokens;
    private int outputTokens;
}
