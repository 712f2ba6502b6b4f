package com.reprise.service;

import com.reprise.model.CacheEntry;
import com.reprise.model.CompletionRequest;
import com.reprise.provider.CompletionBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Completion pipeline: serves from the response cache, otherwise forwards to the
 * backend and stores what comes back.
 */
@Slf4j
@Service
public class CachedCompletionService {

    private final ResponseCacheStore cacheStore;
    private final Optional<CompletionBackend> backend;
    private final Clock clock;

    public CachedCompletionService(
            ResponseCacheStore cacheStore,
            Optional<CompletionBackend> backend,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.backend = backend;
        this.clock = clock;
    }

    /**
     * Complete a request, from cache when possible.
     */
    public Mono<CompletionOutcome> complete(CompletionRequest request) {
        return Mono.defer(() -> {
            Optional<CacheEntry> cached = cacheStore.get(
                    request.getPrompt(), request.getContext(), request.getModel(), request.getTemperature());

            if (cached.isPresent()) {
                CacheEntry entry = cached.get();
                long cacheAgeSeconds = Duration.between(entry.getCreatedAt(), clock.instant()).getSeconds();
                log.info("Serving cached response: id={}, age={}s", entry.getId(), cacheAgeSeconds);

                return Mono.just(CompletionOutcome.builder()
                        .text(entry.getResponse())
                        .model(entry.getModel())
                        .tokensUsed(entry.getTokensUsed())
                        .cacheHit(true)
                        .entryId(entry.getId())
                        .cacheAgeSeconds(cacheAgeSeconds)
                        .build());
            }

            if (backend.isEmpty()) {
                return Mono.error(new IllegalStateException("No completion backend configured"));
            }

            log.info("Cache miss - forwarding to backend {}", backend.get().getName());
            return backend.get().complete(request)
                    .map(result -> {
                        Optional<CacheEntry> stored = cacheStore.setIfEnabled(
                                request.getPrompt(),
                                request.getContext(),
                                request.getModel(),
                                request.getTemperature(),
                                result.getText(),
                                result.getTokensUsed(),
                                result.getInputTokens(),
                                result.getOutputTokens());

                        return CompletionOutcome.builder()
                                .text(result.getText())
                                .model(request.getModel())
                                .tokensUsed(result.getTokensUsed())
                                .cacheHit(false)
                                .entryId(stored.map(CacheEntry::getId).orElse(null))
                                .build();
                    });
        });
    }

    /**
     * Completion with cache metadata.
     */
    @lombok.Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class CompletionOutcome {
        private String text;
        private String model;
        private int tokensUsed;
        private boolean cacheHit;
        private String entryId;  // null when the response was not stored
        private Long cacheAgeSeconds;  // only for cache hits
    }
}
