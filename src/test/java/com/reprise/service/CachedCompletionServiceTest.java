package com.reprise.service;

import com.reprise.model.CacheSettings;
import com.reprise.model.CacheSettingsPatch;
import com.reprise.model.CompletionRequest;
import com.reprise.model.CompletionResult;
import com.reprise.provider.CompletionBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.SimpleIdGenerator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for CachedCompletionService.
 */
class CachedCompletionServiceTest {

    private MutableClock clock;
    private ResponseCacheStore store;
    private CompletionBackend backend;
    private CachedCompletionService service;

    private final CompletionRequest request = CompletionRequest.builder()
            .prompt("Summarize the release notes")
            .context("v2.3.0")
            .model("gpt-4")
            .temperature(0.2)
            .build();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        store = new ResponseCacheStore(
                CacheSettings.defaults(), new CacheKeyGenerator(), clock, new SimpleIdGenerator());
        backend = mock(CompletionBackend.class);
        when(backend.getName()).thenReturn("mock");
        service = new CachedCompletionService(store, Optional.of(backend), clock);
    }

    @Test
    void testMissCallsBackendAndStores() {
        when(backend.complete(any())).thenReturn(Mono.just(new CompletionResult("Three fixes.", 42, 30, 12)));

        StepVerifier.create(service.complete(request))
                .assertNext(outcome -> {
                    assertFalse(outcome.isCacheHit());
                    assertEquals("Three fixes.", outcome.getText());
                    assertEquals(42, outcome.getTokensUsed());
                    assertNotNull(outcome.getEntryId());
                    assertNull(outcome.getCacheAgeSeconds());
                })
                .verifyComplete();

        assertEquals(1, store.getStats().getTotalEntries());
        assertEquals(1, store.getStats().getTotalMisses());
    }

    @Test
    void testHitSkipsBackend() {
        store.set("Summarize the release notes", "v2.3.0", "gpt-4", 0.2, "Three fixes.", 42);
        clock.advance(Duration.ofSeconds(90));

        StepVerifier.create(service.complete(request))
                .assertNext(outcome -> {
                    assertTrue(outcome.isCacheHit());
                    assertEquals("Three fixes.", outcome.getText());
                    assertEquals(90L, outcome.getCacheAgeSeconds());
                })
                .verifyComplete();

        verify(backend, never()).complete(any());
        assertEquals(42, store.getStats().getEstimatedSavings());
    }

    @Test
    void testSecondRequestIsServedFromCache() {
        when(backend.complete(any())).thenReturn(Mono.just(new CompletionResult("Three fixes.", 42, 30, 12)));

        StepVerifier.create(service.complete(request).then(service.complete(request)))
                .assertNext(outcome -> assertTrue(outcome.isCacheHit()))
                .verifyComplete();

        verify(backend, times(1)).complete(any());
    }

    @Test
    void testDisabledCacheAlwaysForwards() {
        store.updateSettings(CacheSettingsPatch.builder().enabled(false).build());
        when(backend.complete(any())).thenReturn(Mono.just(new CompletionResult("Three fixes.", 42, 30, 12)));

        StepVerifier.create(service.complete(request))
                .assertNext(outcome -> {
                    assertFalse(outcome.isCacheHit());
                    assertNull(outcome.getEntryId());
                })
                .verifyComplete();

        assertEquals(0, store.getStats().getTotalEntries());
    }

    @Test
    void testBackendErrorIsNotCached() {
        when(backend.complete(any())).thenReturn(Mono.error(new IllegalStateException("rate limited")));

        StepVerifier.create(service.complete(request))
                .expectErrorMessage("rate limited")
                .verify();

        assertEquals(0, store.getStats().getTotalEntries());
    }

    @Test
    void testMissWithoutBackend() {
        CachedCompletionService cacheOnly = new CachedCompletionService(store, Optional.empty(), clock);

        StepVerifier.create(cacheOnly.complete(request))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
