package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text and token usage returned by a completion backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionResult {

    private String text;
    private int tokensUsed;
    private int inputTokens;
    private int outputTokens;
}
