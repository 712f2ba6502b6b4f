package com.reprise.provider;

import com.reprise.model.CompletionRequest;
import com.reprise.model.CompletionResult;
import reactor.core.publisher.Mono;

/**
 * Generates text for a completion request.
 * Implementations handle provider-specific authentication and API communication.
 */
public interface CompletionBackend {

    /**
     * Get backend name (e.g., "openai", "ollama").
     *
     * @return backend name
     */
    String getName();

    /**
     * Complete a request.
     *
     * @param request prompt, context, model and temperature
     * @return generated text and token usage
     */
    Mono<CompletionResult> complete(CompletionRequest request);
}
