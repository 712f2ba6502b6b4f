package com.reprise.controller;

import com.reprise.config.JacksonConfiguration;
import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheSettings;
import com.reprise.service.CacheKeyGenerator;
import com.reprise.service.CacheSnapshotCodec;
import com.reprise.service.ResponseCacheStore;
import com.reprise.service.SnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.SimpleIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheController.
 */
class CacheControllerTest {

    private ResponseCacheStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        store = new ResponseCacheStore(CacheSettings.defaults(), new CacheKeyGenerator(), clock, new SimpleIdGenerator());
        CacheSnapshotCodec codec = new CacheSnapshotCodec(JacksonConfiguration.createObjectMapper());
        RepriseProperties properties = new RepriseProperties();
        SnapshotService snapshotService = new SnapshotService(store, codec, Optional.empty(), properties);

        client = WebTestClient.bindToController(new CacheController(store, codec, snapshotService, properties))
                .build();
    }

    @Test
    void testStats() {
        store.set("prompt", "", "gpt-4", 0.0, "response", 10);
        store.get("prompt", "", "gpt-4", 0.0);

        client.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_entries").isEqualTo(1)
                .jsonPath("$.total_hits").isEqualTo(1)
                .jsonPath("$.hit_rate").isEqualTo(100.0)
                .jsonPath("$.status").isEqualTo("enabled");
    }

    @Test
    void testPatchSettings() {
        client.patch().uri("/v1/cache/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"maxEntries\": 50}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.maxEntries").isEqualTo(50)
                .jsonPath("$.maxAgeDays").isEqualTo(30);

        assertEquals(50, store.getSettings().getMaxEntries());
    }

    @Test
    void testInvalidSettingsRejected() {
        client.patch().uri("/v1/cache/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"maxEntries\": 10, \"matchThreshold\": 1.5}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");

        assertEquals(CacheSettings.DEFAULT_MAX_ENTRIES, store.getSettings().getMaxEntries());
    }

    @Test
    void testImportSkipsBadEntries() {
        String body = """
                {
                  "entries": [
                    {"id": "1", "prompt": "hello", "response": "hi", "model": "gpt-4",
                     "temperature": 0.0, "tokensUsed": 5, "createdAt": "2026-03-01T11:00:00Z"},
                    {"id": "2", "prompt": "broken"}
                  ]
                }
                """;

        client.post().uri("/v1/cache/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entries").isEqualTo(1);

        assertTrue(store.get("hello", "", "gpt-4", 0.0).isPresent());
    }

    @Test
    void testImportRejectsNonObject() {
        client.post().uri("/v1/cache/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[1, 2, 3]")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void testInvalidate() {
        store.set("deploy to staging", "", "gpt-4", 0.0, "ok", 10);
        store.set("write a haiku", "", "gpt-4", 0.0, "ok", 10);

        client.post().uri("/v1/cache/invalidate?contains=staging")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(1);
    }

    @Test
    void testSnapshotUnavailable() {
        client.post().uri("/v1/cache/snapshot/save")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.available").isEqualTo(false)
                .jsonPath("$.saved").isEqualTo(false);
    }

    @Test
    void testDeleteSnapshotUnavailable() {
        client.delete().uri("/v1/cache/snapshot")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(false);
    }
}
